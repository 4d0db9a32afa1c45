package command;

import model.Bytes;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 지원하는 명령어와 허용 인자 개수, 생성 방법
 */
public enum CommandType {
    GET(1, 1, args -> new GetCommand(args.get(0))),
    SET(2, 2, args -> new SetCommand(args.get(0), args.get(1))),
    PING(0, 1, args -> args.isEmpty() ? new PingCommand() : new PingCommand(args.get(0))),
    ECHO(1, 1, args -> new EchoCommand(args.get(0)));

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.commandName(), type);
        }
    }

    private final int minArgs;
    private final int maxArgs;
    private final Function<List<Bytes>, Command> factory;

    CommandType(int minArgs, int maxArgs, Function<List<Bytes>, Command> factory) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.factory = factory;
    }

    /**
     * 대소문자를 구분하지 않고 명령어를 찾습니다.
     */
    public static CommandType lookup(String name) {
        return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }

    public String commandName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Command create(List<Bytes> args) throws WrongArityException {
        if (args.size() < minArgs || args.size() > maxArgs) {
            throw new WrongArityException(commandName(), minArgs, maxArgs, args.size());
        }
        return factory.apply(args);
    }
}
