package dumb.pdm;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationTests {

    private static Configuration read(String json) throws IOException {
        return Configuration.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void classpathDefaults() throws IOException {
        var c = Configuration.load();
        assertEquals(16, c.maxTableAtoms());
        assertEquals(Backward.CycleGuard.PER_PATH, c.cycleGuard());
        assertEquals(List.of("medical", "loan"), c.domains());
    }

    @Test
    void missingFieldsTakeDefaults() throws IOException {
        var c = read("{\"cycleGuard\": \"SHARED\"}");
        assertEquals(Backward.CycleGuard.SHARED, c.cycleGuard());
        assertEquals(Configuration.DEFAULT_MAX_TABLE_ATOMS, c.maxTableAtoms());
        assertEquals(Configuration.DEFAULT_DOMAINS, c.domains());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IOException.class, () -> read("{\"cycleGuard\": \"SOMETIMES\"}"));
        assertThrows(IOException.class, () -> read("{\"maxTableAtoms\": -1}"));
        assertThrows(IOException.class, () -> read("not json"));
    }

    @Test
    void withers() {
        var c = new Configuration().withMaxTableAtoms(3).withCycleGuard(Backward.CycleGuard.SHARED);
        assertEquals(3, c.maxTableAtoms());
        assertEquals(Backward.CycleGuard.SHARED, c.cycleGuard());
    }
}
