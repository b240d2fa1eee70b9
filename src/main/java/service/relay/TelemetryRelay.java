package service.relay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 双向消息中继
 * 两个转发任务并行运行，任意一个结束 (正常或出错) 即取消另一个并关闭两端
 * 断开和错误都属于会话正常结束，不向上抛出
 */
@Slf4j
@Component
public class TelemetryRelay implements DisposableBean {

    private final ExecutorService executor =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("telemetry-relay-"));

    /**
     * 异步运行一个中继会话
     */
    public CompletableFuture<Void> start(MessageChannel client, MessageChannel controller) {
        return CompletableFuture.runAsync(() -> run(client, controller), executor);
    }

    /**
     * 阻塞运行直到任意一端结束
     */
    public void run(MessageChannel client, MessageChannel controller) {
        CompletionService<String> pumps = new ExecutorCompletionService<>(executor);
        List<Future<String>> tasks = List.of(
                pumps.submit(() -> pump(client, controller)),
                pumps.submit(() -> pump(controller, client)));
        try {
            Future<String> first = pumps.take();
            log.info("中继会话结束: {}", first.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("中继会话被中断");
        } catch (ExecutionException e) {
            log.debug("转发任务异常结束: {}", e.getCause().toString());
        } finally {
            tasks.forEach(task -> task.cancel(true));
            client.close();
            controller.close();
        }
    }

    private String pump(MessageChannel source, MessageChannel target) {
        String direction = source.getName() + " -> " + target.getName();
        try {
            String message;
            while ((message = source.receive()) != null) {
                target.send(message);
            }
            return direction + " 源端已断开";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return direction + " 已取消";
        } catch (IOException e) {
            return direction + " 转发失败: " + e.getMessage();
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
