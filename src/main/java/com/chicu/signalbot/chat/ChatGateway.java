package com.chicu.signalbot.chat;

/**
 * Граница с чат-платформой. Каналы адресуются по имени (без учёта регистра),
 * пользователи: по строковому id.
 *
 * Ядро (воркеры, подтверждения) про платформу ничего не знает:
 * с ней разговаривают только действия и командный слой.
 */
public interface ChatGateway {

    /** Есть ли текстовый канал с таким именем хоть на одном сервере. */
    boolean channelExists(String channelName);

    /**
     * @throws ChatException канал не найден или отправка не удалась
     */
    void sendMessage(String channelName, String content);

    /**
     * Личное сообщение пользователю.
     *
     * @throws ChatException пользователь не найден или ЛС закрыты
     */
    void sendDirectMessage(String userId, String content);

    boolean hasPermission(String channelName, ChatCapability capability);

    /**
     * Удаляет все сообщения канала.
     *
     * @return сколько сообщений удалено
     * @throws ChatException канал не найден или нет прав
     */
    int purgeChannel(String channelName);
}
