package controller;

import common.config.KlipperConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import service.relay.ChannelFeedingHandler;
import service.relay.QueuedSocketChannel;
import service.relay.TelemetryRelay;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Moonraker WebSocket 代理 (/websocket)
 * 每个客户端连接对应一个到 Moonraker 的连接，消息双向原样转发
 */
@Slf4j
@Component
public class TelemetryRelayHandler extends TextWebSocketHandler {

    private final Map<String, QueuedSocketChannel> clientChannels = new ConcurrentHashMap<>();

    private final WebSocketClient webSocketClient;
    private final KlipperConfig klipperConfig;
    private final TelemetryRelay relay;

    public TelemetryRelayHandler(WebSocketClient webSocketClient, KlipperConfig klipperConfig, TelemetryRelay relay) {
        this.webSocketClient = webSocketClient;
        this.klipperConfig = klipperConfig;
        this.relay = relay;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        QueuedSocketChannel clientChannel = new QueuedSocketChannel("client-" + session.getId());
        clientChannel.bind(session);
        clientChannels.put(session.getId(), clientChannel);

        QueuedSocketChannel controllerChannel = new QueuedSocketChannel("moonraker-" + session.getId());
        webSocketClient.execute(new ChannelFeedingHandler(controllerChannel), klipperConfig.getWebsocketUrl())
                .whenComplete((controllerSession, error) -> {
                    if (error != null) {
                        log.warn("Moonraker WebSocket 连接失败 ({}): {}", klipperConfig.getWebsocketUrl(), error.getMessage());
                        clientChannels.remove(session.getId());
                        clientChannel.close();
                        return;
                    }
                    controllerChannel.bind(controllerSession);
                    log.info("中继会话开始: client={}", session.getId());
                    relay.start(clientChannel, controllerChannel)
                            .whenComplete((v, e) -> clientChannels.remove(session.getId()));
                });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        QueuedSocketChannel channel = clientChannels.get(session.getId());
        if (channel != null) {
            channel.offer(message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("客户端连接异常: {}", exception.getMessage());
        endClient(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        endClient(session);
    }

    private void endClient(WebSocketSession session) {
        QueuedSocketChannel channel = clientChannels.get(session.getId());
        if (channel != null) {
            channel.markClosed();
        }
    }
}
