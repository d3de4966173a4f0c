package dev.postify.publish;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Platform name to publisher lookup.
 */
@Slf4j
@Component
public class PublisherRegistry {

    private final Map<String, Publisher> publishers = new LinkedHashMap<>();

    public PublisherRegistry(List<Publisher> publishers) {
        for (Publisher publisher : publishers) {
            this.publishers.put(publisher.getName().toLowerCase(Locale.ROOT), publisher);
        }
        log.info("Publishers registered: {}", this.publishers.keySet());
    }

    public Optional<Publisher> find(String platform) {
        if (platform == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(publishers.get(platform.toLowerCase(Locale.ROOT)));
    }

    public Collection<String> platforms() {
        return publishers.keySet();
    }

    /**
     * Platforms a draft should go to: the console publisher when registered,
     * plus every template platform that has a publisher.
     */
    public List<String> resolvePlatforms(List<String> templatePlatforms) {
        List<String> result = new ArrayList<>();
        if (publishers.containsKey(ConsolePublisher.NAME)) {
            result.add(ConsolePublisher.NAME);
        }
        for (String platform : templatePlatforms) {
            String name = platform.toLowerCase(Locale.ROOT);
            if (result.contains(name)) {
                continue;
            }
            if (publishers.containsKey(name)) {
                result.add(name);
            } else {
                log.debug("No publisher for platform '{}' - skipped", platform);
            }
        }
        return result;
    }
}
