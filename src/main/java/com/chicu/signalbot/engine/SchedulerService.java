package com.chicu.signalbot.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Чистый планировщик одноразовых пробуждений по строковому ключу.
 *
 * Задача этого сервиса: только отложить Runnable и уметь его отменить.
 * Он НЕ знает ни про воркеры, ни про интервалы, ни про подтверждения.
 */
public interface SchedulerService {

    /**
     * Откладывает задачу. Предыдущее ожидание с тем же ключом отменяется.
     *
     * @param key   уникальный ключ (например: "purge", "scan:day", "confirm:...")
     * @param task  что выполнить
     * @param delay через сколько
     */
    ScheduledFuture<?> scheduleOnce(String key, Runnable task, Duration delay);

    /**
     * Отмена ожидания по ключу. Уже выполняющуюся задачу не прерывает.
     */
    void cancel(String key);

    /**
     * Есть ли ещё не сработавшее ожидание по ключу.
     */
    boolean isPending(String key);

    /**
     * Когда ожидание по ключу было поставлено.
     */
    Optional<Instant> getScheduledAt(String key);
}
