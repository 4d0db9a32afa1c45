package command;

import model.Bytes;
import protocol.Frame;
import protocol.FrameType;

import java.util.ArrayList;
import java.util.List;

/**
 * 디코딩된 요청 프레임을 검증하여 {@link Command} 로 변환합니다.
 */
public class CommandParser {

    public Command parse(Frame frame) throws CommandException {
        if (frame.getType() != FrameType.ARRAY) {
            throw new CommandException("Protocol error: expected array of bulk strings");
        }
        List<Frame> elements = frame.getElements();
        if (elements.isEmpty()) {
            throw new CommandException("empty command");
        }

        List<Bytes> parts = new ArrayList<>(elements.size());
        for (Frame element : elements) {
            if (element.getType() != FrameType.BULK_STRING) {
                throw new CommandException("Protocol error: expected array of bulk strings");
            }
            parts.add(element.getData());
        }

        String name = parts.get(0).asString();
        CommandType type = CommandType.lookup(name);
        if (type == null) {
            throw new UnknownCommandException(name);
        }
        return type.create(parts.subList(1, parts.size()));
    }
}
