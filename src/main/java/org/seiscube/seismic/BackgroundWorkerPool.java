package org.seiscube.seismic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 后台持久化任务的固定大小线程池（有界队列）。
 * <p>
 * 生命周期：{@link #start()} -> {@link #submit} ... -> {@link #drain(Duration)} -> {@link #shutdown(Duration)}。
 * <ul>
 *   <li>提交不阻塞：队列满或线程池未运行时任务被丢弃并计数（持久化是尽力而为的）。</li>
 *   <li>任务之间不保证顺序；任务异常只记录日志，不会传播给提交方。</li>
 *   <li>{@link #drain(Duration)} 等待已提交任务全部结束，测试可据此确定性地等待后台写入完成。</li>
 * </ul>
 */
public class BackgroundWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundWorkerPool.class);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final int threads;
    private final int queueCapacity;
    private final Object lock = new Object();

    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile ThreadPoolExecutor executor;

    public BackgroundWorkerPool(String name, int threads, int queueCapacity) {
        this.name = name;
        this.threads = Math.max(1, threads);
        this.queueCapacity = Math.max(1, queueCapacity);
    }

    public void start() {
        synchronized (lock) {
            if (executor != null && !executor.isShutdown()) {
                return;
            }
            AtomicInteger threadCounter = new AtomicInteger();
            executor = new ThreadPoolExecutor(
                    threads,
                    threads,
                    0L,
                    TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(queueCapacity),
                    r -> {
                        Thread t = new Thread(r, name + "-" + threadCounter.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    },
                    new ThreadPoolExecutor.AbortPolicy()
            );
        }
    }

    public boolean isRunning() {
        ThreadPoolExecutor current = executor;
        return current != null && !current.isShutdown();
    }

    /**
     * 提交任务（不阻塞）。
     *
     * @param description 用于日志的任务描述
     * @return 是否已入队；false 表示任务被丢弃
     */
    public boolean submit(String description, Runnable task) {
        ThreadPoolExecutor current = executor;
        if (current == null || current.isShutdown()) {
            dropped.incrementAndGet();
            log.warn("后台线程池未运行，已丢弃任务：{}", description);
            return false;
        }
        pending.incrementAndGet();
        try {
            current.execute(() -> runTask(description, task));
            return true;
        } catch (RejectedExecutionException e) {
            finishTask();
            dropped.incrementAndGet();
            log.warn("后台队列已满（容量 {}），已丢弃任务：{}", queueCapacity, description);
            return false;
        }
    }

    /**
     * 等待所有已提交任务结束。
     *
     * @return 超时前全部结束返回 true
     */
    public boolean drain(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (pending.get() > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                lock.wait(remainingMs);
            }
            return true;
        }
    }

    /**
     * 停止接收新任务，等待队列中的任务在超时内完成，超时后中断剩余任务。
     */
    public void shutdown(Duration timeout) {
        ThreadPoolExecutor current;
        synchronized (lock) {
            current = executor;
        }
        if (current == null || current.isShutdown()) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int abandoned = abandonQueued(current);
                log.warn("后台线程池 {} 关闭超时，放弃 {} 个排队任务", name, abandoned);
            }
        } catch (InterruptedException e) {
            int abandoned = abandonQueued(current);
            log.warn("等待后台线程池 {} 关闭时被中断，放弃 {} 个排队任务", name, abandoned);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 立即停止线程池；从未开始执行的排队任务按丢弃计数，并从待完成数中扣除。
     */
    private int abandonQueued(ThreadPoolExecutor current) {
        int abandoned = current.shutdownNow().size();
        if (abandoned > 0) {
            dropped.addAndGet(abandoned);
            pending.addAndGet(-abandoned);
            synchronized (lock) {
                lock.notifyAll();
            }
        }
        return abandoned;
    }

    @Override
    public void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public int pendingTasks() {
        return pending.get();
    }

    public long completedTasks() {
        return completed.get();
    }

    public long failedTasks() {
        return failed.get();
    }

    public long droppedTasks() {
        return dropped.get();
    }

    private void runTask(String description, Runnable task) {
        try {
            task.run();
            completed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("后台任务失败：{}（{}）", description, e.getMessage(), e);
        } finally {
            finishTask();
        }
    }

    private void finishTask() {
        if (pending.decrementAndGet() == 0) {
            synchronized (lock) {
                lock.notifyAll();
            }
        }
    }
}
