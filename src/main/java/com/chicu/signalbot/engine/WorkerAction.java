package com.chicu.signalbot.engine;

/**
 * То, что воркер выполняет на каждой границе расписания (очистка канала, сканирование рынка).
 * Планировщик не знает, какую именно реализацию держит.
 */
@FunctionalInterface
public interface WorkerAction {

    ActionResult run() throws Exception;
}
