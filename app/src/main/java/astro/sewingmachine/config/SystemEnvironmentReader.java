package astro.sewingmachine.config;

import java.util.Optional;

/**
 * Looks settings up in the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
