package service.relay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 把回调式的 WebSocketSession 适配成阻塞式通道
 * WebSocket 回调线程调用 offer/markClosed，转发任务调用 receive/send
 * 队列有界: 对端读得慢时 offer 阻塞回调线程，由传输层做流量控制
 */
@Slf4j
public class QueuedSocketChannel implements MessageChannel {

    public static final int DEFAULT_CAPACITY = 64;
    private static final long OFFER_POLL_MILLIS = 100;

    private final String name;
    // Optional.empty() 表示流结束
    private final BlockingQueue<Optional<String>> inbound;
    private volatile WebSocketSession session;
    private volatile boolean closed;

    public QueuedSocketChannel(String name) {
        this(name, DEFAULT_CAPACITY);
    }

    public QueuedSocketChannel(String name, int capacity) {
        this.name = name;
        this.inbound = new LinkedBlockingQueue<>(capacity);
    }

    public void bind(WebSocketSession session) {
        this.session = session;
        if (closed) {
            closeSession();
        }
    }

    /**
     * 收到对端消息 队列满时阻塞直到有空位或通道关闭
     */
    public void offer(String message) {
        Optional<String> item = Optional.of(message);
        try {
            while (!closed) {
                if (inbound.offer(item, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} 入队被中断，消息丢弃", name);
        }
    }

    /**
     * 对端已断开 只结束读取 不再主动关闭会话
     * 未读消息直接丢弃 保证结束标记一定能入队
     */
    public void markClosed() {
        closed = true;
        inbound.clear();
        inbound.offer(Optional.empty());
    }

    public int pending() {
        return inbound.size();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String receive() throws InterruptedException {
        if (closed && inbound.isEmpty()) {
            return null;
        }
        Optional<String> next = inbound.take();
        if (next.isEmpty() || closed) {
            // 让其他等待者也能看到结束标记
            inbound.offer(Optional.empty());
            return null;
        }
        return next.get();
    }

    @Override
    public void send(String message) throws IOException {
        WebSocketSession current = session;
        if (closed || current == null || !current.isOpen()) {
            throw new IOException(name + " 通道已关闭");
        }
        current.sendMessage(new TextMessage(message));
    }

    @Override
    public void close() {
        markClosed();
        closeSession();
    }

    @Override
    public boolean isOpen() {
        return !closed;
    }

    private void closeSession() {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("{} 会话关闭失败: {}", name, e.getMessage());
            }
        }
    }
}
