package tollgate.system.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MeteredPaths")
class MeteredPathsTest {

    private final MeteredPaths paths = new MeteredPaths(
            List.of("/api/"),
            Map.of("chat", "/api/chat", "chat-stream", "/api/chat/stream", "storage", "api/files"),
            "default");

    @Test
    @DisplayName("meters the prefix and everything below it")
    void metered() {
        assertTrue(paths.isMetered("/api"));
        assertTrue(paths.isMetered("/api/chat"));
        assertTrue(paths.isMetered("api/anything/else"));
        assertFalse(paths.isMetered("/apis"));
        assertFalse(paths.isMetered("/q/health"));
    }

    @Test
    @DisplayName("matches categories on segment boundaries, longest prefix first")
    void categories() {
        assertEquals("chat", paths.categoryFor("/api/chat"));
        assertEquals("chat", paths.categoryFor("/api/chat/"));
        assertEquals("chat-stream", paths.categoryFor("/api/chat/stream/1"));
        assertEquals("storage", paths.categoryFor("/api/files/report.pdf"));
        assertEquals("default", paths.categoryFor("/api/chatter"));
    }

    @Test
    @DisplayName("a root prefix meters everything")
    void rootPrefix() {
        var all = new MeteredPaths(List.of("/"), Map.of(), "default");

        assertTrue(all.isMetered("/anything"));
        assertEquals("default", all.categoryFor("/anything"));
    }
}
