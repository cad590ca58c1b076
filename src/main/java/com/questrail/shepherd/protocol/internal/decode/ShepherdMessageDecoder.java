package com.questrail.shepherd.protocol.internal.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.shepherd.protocol.internal.frame.FrameType;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;
import com.questrail.shepherd.protocol.internal.json.ProtocolJson;
import com.questrail.shepherd.protocol.model.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ShepherdMessageDecoder
 * ============================================================================
 * Converts a {@link ShepherdFrame} into a semantic {@link ShepherdMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between protocol mechanics (type bytes, JSON
 * field names, base64) and protocol semantics. The daemon and the client
 * operate only on {@link ClientMessage} and {@link ServerMessage}.
 *
 * <h2>Unknown and misdirected frames</h2>
 * A frame whose type code is unknown, or whose type belongs to the other
 * direction, decodes to {@link Optional#empty()} and is ignored by the
 * caller. This keeps older peers working when a newer peer adds frame types.
 *
 * <h2>Malformed frames</h2>
 * A known frame with an unusable payload raises
 * {@link ShepherdDecodeException}. What that means for the connection is the
 * caller's decision.
 */
public final class ShepherdMessageDecoder
{
    /**
     * Decode a frame received by the shepherd.
     */
    public Optional<ClientMessage> decodeClient(ShepherdFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        Optional<FrameType> type = frame.type();
        if (type.isEmpty()) {
            return Optional.empty();
        }

        final byte[] payload = frame.payload();
        switch (type.get()) {
            case HELLO: {
                JsonNode json = parse(FrameType.HELLO, payload);
                return Optional.of(new Hello(requireInt(json, "version", FrameType.HELLO)));
            }
            case WRITE:
                return Optional.of(new WriteInput(payload));
            case RESIZE: {
                JsonNode json = parse(FrameType.RESIZE, payload);
                int cols = requireInt(json, "cols", FrameType.RESIZE);
                int rows = requireInt(json, "rows", FrameType.RESIZE);
                if (cols <= 0 || rows <= 0) {
                    throw new ShepherdDecodeException("RESIZE requires positive cols/rows, got " + cols + "x" + rows);
                }
                return Optional.of(new Resize(cols, rows));
            }
            case KILL: {
                JsonNode json = parse(FrameType.KILL, payload);
                return Optional.of(new Kill(requireInt(json, "signal", FrameType.KILL)));
            }
            case SPAWN:
                return Optional.of(decodeSpawn(payload));
            case PING:
                return Optional.of(new Ping());
            default:
                // Server-bound types arriving at the shepherd are ignored.
                return Optional.empty();
        }
    }

    /**
     * Decode a frame received by a controller.
     */
    public Optional<ServerMessage> decodeServer(ShepherdFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        Optional<FrameType> type = frame.type();
        if (type.isEmpty()) {
            return Optional.empty();
        }

        final byte[] payload = frame.payload();
        switch (type.get()) {
            case DATA:
                return Optional.of(new Data(payload));
            case WELCOME:
                return Optional.of(decodeWelcome(payload));
            case EXIT:
                return Optional.of(decodeExit(payload));
            case PONG:
                return Optional.of(new Pong());
            default:
                return Optional.empty();
        }
    }

    // ---------------------------------------------------------------------

    private static Welcome decodeWelcome(byte[] payload)
    {
        JsonNode json = parse(FrameType.WELCOME, payload);

        int version = requireInt(json, "protocolVersion", FrameType.WELCOME);
        long pid = requireLong(json, "pid", FrameType.WELCOME);
        long startTime = requireLong(json, "startTime", FrameType.WELCOME);

        JsonNode replayNode = json.get("replay");
        if (replayNode == null || !replayNode.isTextual()) {
            throw new ShepherdDecodeException("WELCOME field 'replay' must be a base64 string");
        }
        final byte[] replay;
        try {
            replay = replayNode.binaryValue();
        }
        catch (IOException e) {
            throw new ShepherdDecodeException("WELCOME field 'replay' is not valid base64", e);
        }

        long workerPid = optionalLong(json, "workerPid", -1L, FrameType.WELCOME);
        int cols = (int) optionalLong(json, "cols", 0L, FrameType.WELCOME);
        int rows = (int) optionalLong(json, "rows", 0L, FrameType.WELCOME);

        return new Welcome(version, pid, workerPid, startTime, cols, rows, replay);
    }

    private static Exit decodeExit(byte[] payload)
    {
        JsonNode json = parse(FrameType.EXIT, payload);

        JsonNode code = json.get("code");
        final Integer exitCode;
        if (code == null || code.isNull()) {
            exitCode = null;
        }
        else if (code.isIntegralNumber() && code.canConvertToInt()) {
            exitCode = code.intValue();
        }
        else {
            throw new ShepherdDecodeException("EXIT field 'code' must be an integer or null");
        }

        JsonNode signal = json.get("signal");
        final String signalName;
        if (signal == null || signal.isNull()) {
            signalName = null;
        }
        else if (signal.isTextual()) {
            signalName = signal.textValue();
        }
        else {
            throw new ShepherdDecodeException("EXIT field 'signal' must be a string or null");
        }

        return new Exit(exitCode, signalName);
    }

    private static Spawn decodeSpawn(byte[] payload)
    {
        JsonNode json = parse(FrameType.SPAWN, payload);

        String command = requireText(json, "command", FrameType.SPAWN);
        String cwd = requireText(json, "cwd", FrameType.SPAWN);

        List<String> args = new ArrayList<>();
        JsonNode argsNode = json.get("args");
        if (argsNode != null && !argsNode.isNull()) {
            if (!argsNode.isArray()) {
                throw new ShepherdDecodeException("SPAWN field 'args' must be an array");
            }
            for (JsonNode arg : argsNode) {
                if (!arg.isTextual()) {
                    throw new ShepherdDecodeException("SPAWN field 'args' must contain only strings");
                }
                args.add(arg.textValue());
            }
        }

        Map<String, String> env = new LinkedHashMap<>();
        JsonNode envNode = json.get("env");
        if (envNode != null && !envNode.isNull()) {
            if (!envNode.isObject()) {
                throw new ShepherdDecodeException("SPAWN field 'env' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = envNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                if (!e.getValue().isTextual()) {
                    throw new ShepherdDecodeException("SPAWN env value for '" + e.getKey() + "' must be a string");
                }
                env.put(e.getKey(), e.getValue().textValue());
            }
        }

        return new Spawn(command, args, cwd, env);
    }

    // ---------------------------------------------------------------------

    private static JsonNode parse(FrameType type, byte[] payload)
    {
        final JsonNode json;
        try {
            json = ProtocolJson.readTree(payload);
        }
        catch (IOException e) {
            throw new ShepherdDecodeException(type + " payload is not valid JSON", e);
        }
        if (!json.isObject()) {
            throw new ShepherdDecodeException(type + " payload must be a JSON object");
        }
        return json;
    }

    private static int requireInt(JsonNode json, String field, FrameType type)
    {
        JsonNode n = json.get(field);
        if (n == null || !n.isIntegralNumber() || !n.canConvertToInt()) {
            throw new ShepherdDecodeException(type + " field '" + field + "' must be an integer");
        }
        return n.intValue();
    }

    private static long requireLong(JsonNode json, String field, FrameType type)
    {
        JsonNode n = json.get(field);
        if (n == null || !n.isIntegralNumber() || !n.canConvertToLong()) {
            throw new ShepherdDecodeException(type + " field '" + field + "' must be an integer");
        }
        return n.longValue();
    }

    private static long optionalLong(JsonNode json, String field, long fallback, FrameType type)
    {
        JsonNode n = json.get(field);
        if (n == null || n.isNull()) {
            return fallback;
        }
        if (!n.isIntegralNumber() || !n.canConvertToLong()) {
            throw new ShepherdDecodeException(type + " field '" + field + "' must be an integer");
        }
        return n.longValue();
    }

    private static String requireText(JsonNode json, String field, FrameType type)
    {
        JsonNode n = json.get(field);
        if (n == null || !n.isTextual()) {
            throw new ShepherdDecodeException(type + " field '" + field + "' must be a string");
        }
        return n.textValue();
    }
}
