package xyz.firestige.netops.infrastructure.config;

import xyz.firestige.netops.domain.device.Inventory;
import xyz.firestige.netops.domain.intent.IntentSet;

/**
 * 加载结果：设备清单与目标配置
 */
public record FleetDefinition(Inventory inventory, IntentSet intents) {
}
