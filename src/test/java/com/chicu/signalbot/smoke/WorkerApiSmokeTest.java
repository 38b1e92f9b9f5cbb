package com.chicu.signalbot.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "bot.discord.token=",
                "bot.purge.channel-name=requests",
                "bot.scan.strategies.long.channel-name="
        })
class WorkerApiSmokeTest {

    @LocalServerPort
    int port;

    TestRestTemplate rest = new TestRestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + "/api/workers" + path;
    }

    @Test
    void listShouldContainConfiguredWorkersOnly() {
        ResponseEntity<List> resp = rest.getForEntity(url(""), List.class);

        assertEquals(200, resp.getStatusCode().value());
        List<?> body = resp.getBody();
        assertNotNull(body);
        List<?> names = body.stream().map(w -> ((Map<?, ?>) w).get("name")).toList();
        assertEquals(List.of("purge", "day", "swing"), names);
    }

    @Test
    void purgeShouldBeRunningWithSixHourInterval() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/purge"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("RUNNING", resp.getBody().get("state"));
        assertEquals("6h", resp.getBody().get("interval"));
        assertEquals("requests", resp.getBody().get("target"));
    }

    @Test
    void unknownWorkerShouldBe404() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/long"), Map.class);

        assertEquals(404, resp.getStatusCode().value());
        assertEquals("WorkerNotConfiguredException", resp.getBody().get("error"));
    }

    @Test
    void purgeTriggerShouldBeRejectedWithoutRunning() {
        ResponseEntity<Map> resp = rest.postForEntity(url("/purge/trigger"), null, Map.class);

        assertEquals(409, resp.getStatusCode().value());
        assertEquals("REJECTED", resp.getBody().get("result"));

        Map<?, ?> status = rest.getForEntity(url("/purge"), Map.class).getBody();
        assertNull(status.get("lastRunAt"), "очистка не должна запускаться без подтверждения");
        assertNull(status.get("lastResult"));
    }

    @Test
    void scanTriggerShouldRunImmediately() {
        ResponseEntity<Map> resp = rest.postForEntity(url("/swing/trigger"), null, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("SKIPPED", resp.getBody().get("result"), "без чата канала нет, скан пропускается");
    }
}
