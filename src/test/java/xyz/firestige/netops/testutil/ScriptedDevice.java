package xyz.firestige.netops.testutil;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import xyz.firestige.netops.exception.ConnectionException;

/**
 * 可编排行为的模拟设备
 * <p>
 * 记录收到的全部命令；可注入连接失败、命令拒绝、延迟、阻塞与采集失败。
 */
public class ScriptedDevice {

    public static final String VERSION_LINE = "Cisco IOS Software, C2900 Software, Version 15.2(4)M7";
    public static final String REJECTED_OUTPUT = "% Invalid input detected at '^' marker.";

    private final String name;
    private final AtomicInteger connectFailuresRemaining = new AtomicInteger();
    private final AtomicInteger connectAttempts = new AtomicInteger();
    private final List<String> configCommands = new CopyOnWriteArrayList<>();
    private final List<String> execCommands = new CopyOnWriteArrayList<>();
    private final Map<String, RuntimeException> execFailures = new ConcurrentHashMap<>();
    private final Map<String, String> replies = new ConcurrentHashMap<>();
    private final AtomicInteger stalledExecutesRemaining = new AtomicInteger();
    private volatile Duration stall = Duration.ZERO;
    private volatile boolean alwaysFailConnect;
    private volatile String rejectFragment;
    private volatile Duration commandDelay = Duration.ZERO;
    private volatile String runningConfig;
    private volatile CountDownLatch configGate;
    private volatile CountDownLatch configEntered;

    public ScriptedDevice(String name) {
        this.name = name;
        this.runningConfig = "Building configuration...\n\nCurrent configuration : 120 bytes\n!\nhostname " + name
                + "\n!\ninterface GigabitEthernet0/0\n ip address 10.0.0.1 255.255.255.0\n!\nend\n";
    }

    public ScriptedDevice failConnect(int times) {
        connectFailuresRemaining.set(times);
        return this;
    }

    public ScriptedDevice alwaysFailConnect() {
        this.alwaysFailConnect = true;
        return this;
    }

    public ScriptedDevice rejectCommandsContaining(String fragment) {
        this.rejectFragment = fragment;
        return this;
    }

    public ScriptedDevice commandDelay(Duration delay) {
        this.commandDelay = delay;
        return this;
    }

    public ScriptedDevice runningConfig(String runningConfig) {
        this.runningConfig = runningConfig;
        return this;
    }

    public ScriptedDevice failOn(String command, RuntimeException failure) {
        execFailures.put(command, failure);
        return this;
    }

    /**
     * 固定某条 show 命令的输出
     */
    public ScriptedDevice replyTo(String command, String output) {
        replies.put(command, output);
        return this;
    }

    /**
     * 前 count 条 show 命令忙等 duration，期间不理会中断（模拟阻塞在 socket 读上的会话）
     */
    public ScriptedDevice stallIgnoringInterrupts(int count, Duration duration) {
        this.stall = duration;
        this.stalledExecutesRemaining.set(count);
        return this;
    }

    public ScriptedDevice clearFailures() {
        execFailures.clear();
        return this;
    }

    /**
     * 下发配置时先通知 entered，再阻塞直到 gate 放行
     */
    public ScriptedDevice blockConfigUntil(CountDownLatch entered, CountDownLatch gate) {
        this.configEntered = entered;
        this.configGate = gate;
        return this;
    }

    void onConnect() {
        connectAttempts.incrementAndGet();
        if (alwaysFailConnect) {
            throw new ConnectionException("连接被拒绝: " + name);
        }
        if (connectFailuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new ConnectionException("连接超时: " + name);
        }
    }

    String execute(String command) {
        stallIfScripted();
        pause();
        execCommands.add(command);
        RuntimeException failure = execFailures.get(command);
        if (failure != null) {
            throw failure;
        }
        String reply = replies.get(command);
        if (reply != null) {
            return reply;
        }
        if (command.equals("show running-config")) {
            return runningConfig;
        }
        if (command.startsWith("show version")) {
            return VERSION_LINE;
        }
        if (command.startsWith("show run | include hostname")) {
            return "hostname " + name;
        }
        if (command.equals("write memory")) {
            return "Building configuration...\n[OK]";
        }
        return "";
    }

    String executeConfig(List<String> commands) {
        CountDownLatch entered = configEntered;
        if (entered != null) {
            entered.countDown();
        }
        CountDownLatch gate = configGate;
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("gate 未放行");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("等待 gate 时被中断", e);
            }
        }
        pause();
        configCommands.addAll(commands);
        String fragment = rejectFragment;
        if (fragment != null) {
            for (String command : commands) {
                if (command.contains(fragment)) {
                    return command + "\n" + REJECTED_OUTPUT;
                }
            }
        }
        return String.join("\n", commands);
    }

    private void stallIfScripted() {
        if (stalledExecutesRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            long deadline = System.nanoTime() + stall.toNanos();
            while (System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
        }
    }

    private void pause() {
        long millis = commandDelay.toMillis();
        if (millis > 0) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("命令被中断", e);
            }
        }
    }

    public String getName() {
        return name;
    }

    public int getConnectAttempts() {
        return connectAttempts.get();
    }

    public List<String> getConfigCommands() {
        return List.copyOf(configCommands);
    }

    public List<String> getExecCommands() {
        return List.copyOf(execCommands);
    }
}
