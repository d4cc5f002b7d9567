package xyz.firestige.netops.validation;

import xyz.firestige.netops.domain.device.Inventory;
import xyz.firestige.netops.domain.intent.IntentSet;

/**
 * 校验器的输入：设备清单与全部目标配置
 */
public record ValidationInput(Inventory inventory, IntentSet intents) {
}
