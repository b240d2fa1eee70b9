package service.relay;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 控制器一侧的 WebSocket 回调 把收到的消息放进通道
 */
public class ChannelFeedingHandler extends TextWebSocketHandler {

    private final QueuedSocketChannel channel;

    public ChannelFeedingHandler(QueuedSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        channel.offer(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        channel.markClosed();
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        channel.markClosed();
    }
}
