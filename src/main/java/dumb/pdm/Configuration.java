package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.pdm.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static java.util.Objects.requireNonNull;

public record Configuration(
        @JsonProperty("maxTableAtoms") int maxTableAtoms,
        @JsonProperty("cycleGuard") Backward.CycleGuard cycleGuard,
        @JsonProperty("domains") List<String> domains
) {
    public static final String RESOURCE = "pdm.json";
    public static final int DEFAULT_MAX_TABLE_ATOMS = 16;
    public static final Backward.CycleGuard DEFAULT_CYCLE_GUARD = Backward.CycleGuard.PER_PATH;
    public static final List<String> DEFAULT_DOMAINS = List.of("medical", "loan");

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    public Configuration {
        if (maxTableAtoms < 0) throw new IllegalArgumentException("maxTableAtoms must be >= 0: " + maxTableAtoms);
        requireNonNull(cycleGuard);
        domains = List.copyOf(domains);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("maxTableAtoms") Integer maxTableAtoms,
            @JsonProperty("cycleGuard") Backward.CycleGuard cycleGuard,
            @JsonProperty("domains") List<String> domains
    ) {
        this(
                maxTableAtoms != null ? maxTableAtoms : DEFAULT_MAX_TABLE_ATOMS,
                cycleGuard != null ? cycleGuard : DEFAULT_CYCLE_GUARD,
                domains != null ? domains : DEFAULT_DOMAINS
        );
    }

    public Configuration() {
        this(DEFAULT_MAX_TABLE_ATOMS, DEFAULT_CYCLE_GUARD, DEFAULT_DOMAINS);
    }

    /** Reads {@value #RESOURCE} from the classpath, falling back to defaults when absent. */
    public static Configuration load() throws IOException {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.info("No {} on classpath, using defaults", RESOURCE);
                return new Configuration();
            }
            return load(in);
        }
    }

    public static Configuration load(InputStream in) throws IOException {
        var c = Json.the.readValue(in, Configuration.class);
        logger.info("Configuration: {}", c);
        return c;
    }

    public Configuration withCycleGuard(Backward.CycleGuard guard) {
        return new Configuration(maxTableAtoms, guard, domains);
    }

    public Configuration withMaxTableAtoms(int max) {
        return new Configuration(max, cycleGuard, domains);
    }
}
