package service.relay;

import java.io.IOException;

/**
 * 中继一端的消息通道
 */
public interface MessageChannel {

    String getName();

    /**
     * 阻塞等待下一条消息
     * @return 消息内容 通道已关闭时返回 null
     */
    String receive() throws InterruptedException;

    /**
     * 原样转发一条消息 通道已关闭时抛出 IOException
     */
    void send(String message) throws IOException;

    /**
     * 关闭通道 可重复调用
     */
    void close();

    boolean isOpen();
}
