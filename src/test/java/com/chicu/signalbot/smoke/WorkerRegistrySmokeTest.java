package com.chicu.signalbot.smoke;

import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.chat.OfflineChatGateway;
import com.chicu.signalbot.command.CommandRouter;
import com.chicu.signalbot.engine.WorkerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "bot.discord.token=")
class WorkerRegistrySmokeTest {

    @Autowired
    WorkerRegistry registry;

    @Autowired
    ChatGateway chat;

    @Autowired
    CommandRouter router;

    @Test
    void shouldRegisterScannersAndRunOffline() {
        assertTrue(registry.isSealed());
        assertTrue(registry.contains("day"));
        assertTrue(registry.contains("swing"));
        assertTrue(registry.contains("long"));
        assertFalse(registry.contains("purge"), "канал заявок не задан");
        assertInstanceOf(OfflineChatGateway.class, chat);
        assertEquals("!", router.getPrefix());
    }
}
