package command;

import lombok.Getter;

/**
 * 인자 개수가 명령어의 허용 범위를 벗어났을 때 발생합니다.
 */
@Getter
public class WrongArityException extends CommandException {

    private final String commandName;
    private final int minArgs;
    private final int maxArgs;
    private final int actualArgs;

    public WrongArityException(String commandName, int minArgs, int maxArgs, int actualArgs) {
        super("wrong number of arguments for '" + commandName + "' command (expected "
            + describe(minArgs, maxArgs) + ", got " + actualArgs + ")");
        this.commandName = commandName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.actualArgs = actualArgs;
    }

    private static String describe(int minArgs, int maxArgs) {
        if (minArgs == maxArgs) {
            return String.valueOf(minArgs);
        }
        if (maxArgs == minArgs + 1) {
            return minArgs + " or " + maxArgs;
        }
        return minArgs + " to " + maxArgs;
    }
}
