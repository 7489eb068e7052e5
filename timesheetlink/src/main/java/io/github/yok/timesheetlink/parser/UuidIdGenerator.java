package io.github.yok.timesheetlink.parser;

import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * {@link IdGenerator} that issues random (version 4) UUIDs.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
public class UuidIdGenerator implements IdGenerator {

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }
}
