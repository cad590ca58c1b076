package com.questrail.shepherd.protocol.internal.encode;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.shepherd.protocol.internal.frame.FrameType;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;
import com.questrail.shepherd.protocol.internal.json.ProtocolJson;
import com.questrail.shepherd.protocol.model.*;

import java.util.Map;
import java.util.Objects;

/**
 * ShepherdMessageEncoder
 * ============================================================================
 * Converts a semantic {@link ShepherdMessage} into a {@link ShepherdFrame}.
 *
 * <p>This encoder is the mirror of {@code ShepherdMessageDecoder}. It selects
 * the frame type and builds the payload (raw bytes for DATA/WRITE, compact
 * JSON for control frames). Byte-level framing is left to the frame encoder.</p>
 */
public final class ShepherdMessageEncoder
{
    public ShepherdFrame encode(ShepherdMessage message)
    {
        Objects.requireNonNull(message, "message");

        if (message instanceof ClientMessage client) {
            return encodeClient(client);
        }
        return encodeServer((ServerMessage) message);
    }

    private static ShepherdFrame encodeClient(ClientMessage message)
    {
        if (message instanceof Hello m) {
            ObjectNode json = ProtocolJson.object();
            json.put("version", m.version());
            return json(FrameType.HELLO, json);
        }
        if (message instanceof WriteInput m) {
            return new ShepherdFrame(FrameType.WRITE, m.bytes());
        }
        if (message instanceof Resize m) {
            ObjectNode json = ProtocolJson.object();
            json.put("cols", m.cols());
            json.put("rows", m.rows());
            return json(FrameType.RESIZE, json);
        }
        if (message instanceof Kill m) {
            ObjectNode json = ProtocolJson.object();
            json.put("signal", m.signal());
            return json(FrameType.KILL, json);
        }
        if (message instanceof Spawn m) {
            ObjectNode json = ProtocolJson.object();
            json.put("command", m.command());
            ArrayNode args = json.putArray("args");
            m.args().forEach(args::add);
            json.put("cwd", m.cwd());
            ObjectNode env = json.putObject("env");
            for (Map.Entry<String, String> e : m.env().entrySet()) {
                env.put(e.getKey(), e.getValue());
            }
            return json(FrameType.SPAWN, json);
        }
        if (message instanceof Ping) {
            return new ShepherdFrame(FrameType.PING, new byte[0]);
        }
        throw new IllegalArgumentException("Unsupported client message: " + message.getClass().getName());
    }

    private static ShepherdFrame encodeServer(ServerMessage message)
    {
        if (message instanceof Data m) {
            return new ShepherdFrame(FrameType.DATA, m.bytes());
        }
        if (message instanceof Welcome m) {
            ObjectNode json = ProtocolJson.object();
            json.put("protocolVersion", m.protocolVersion());
            json.put("pid", m.pid());
            json.put("workerPid", m.workerPid());
            json.put("startTime", m.startTime());
            json.put("cols", m.cols());
            json.put("rows", m.rows());
            // Jackson writes byte[] as base64 text.
            json.put("replay", m.replay());
            return json(FrameType.WELCOME, json);
        }
        if (message instanceof Exit m) {
            ObjectNode json = ProtocolJson.object();
            if (m.code() == null) {
                json.putNull("code");
            } else {
                json.put("code", m.code().intValue());
            }
            if (m.signal() == null) {
                json.putNull("signal");
            } else {
                json.put("signal", m.signal());
            }
            return json(FrameType.EXIT, json);
        }
        if (message instanceof Pong) {
            return new ShepherdFrame(FrameType.PONG, new byte[0]);
        }
        throw new IllegalArgumentException("Unsupported server message: " + message.getClass().getName());
    }

    private static ShepherdFrame json(FrameType type, ObjectNode json)
    {
        return new ShepherdFrame(type, ProtocolJson.toBytes(json));
    }
}
