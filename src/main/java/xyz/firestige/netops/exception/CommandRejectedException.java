package xyz.firestige.netops.exception;

/**
 * 设备拒绝了下发的命令，不重试
 */
public class CommandRejectedException extends NetOpsException {

    private final String command;

    private final String output;

    public CommandRejectedException(String command, String output) {
        super(ErrorType.COMMAND_REJECTED, "设备拒绝命令: " + command);
        this.command = command;
        this.output = output;
    }

    public String getCommand() {
        return command;
    }

    public String getOutput() {
        return output;
    }
}
