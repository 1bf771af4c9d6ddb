package org.example.blobstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * try-* 系列操作的适配器：调用严格操作，把任何失败（包括非预期的运行时异常）转换成 {@code false}。
 * <p>
 * 只有这里允许吞掉异常；严格操作本身不做任何吞异常处理。
 */
public final class Attempts {

    private static final Logger log = LoggerFactory.getLogger(Attempts.class);

    private Attempts() {
    }

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    @FunctionalInterface
    public interface Check {
        boolean test() throws Exception;
    }

    /**
     * 执行 action，正常返回则为 {@code true}，抛出任何异常则为 {@code false}。
     */
    public static boolean succeeded(String operation, String path, Action action) {
        try {
            action.run();
            return true;
        } catch (Exception e) {
            log.debug("{} 失败（已忽略）：{}", operation, path, e);
            return false;
        }
    }

    /**
     * 执行 check 并返回其结果；抛出任何异常则为 {@code false}。
     */
    public static boolean holds(String operation, String path, Check check) {
        try {
            return check.test();
        } catch (Exception e) {
            log.debug("{} 失败（已忽略）：{}", operation, path, e);
            return false;
        }
    }
}
