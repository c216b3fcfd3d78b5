package me.go_gradually.echomind.application.shared.port;

import java.util.concurrent.Future;

@FunctionalInterface
public interface AsyncExecutor {
    Future<?> submit(Runnable task);
}
