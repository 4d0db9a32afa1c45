package command;

import lombok.Getter;

@Getter
public class UnknownCommandException extends CommandException {

    private final String commandName;

    public UnknownCommandException(String commandName) {
        super("unknown command '" + commandName + "'");
        this.commandName = commandName;
    }
}
