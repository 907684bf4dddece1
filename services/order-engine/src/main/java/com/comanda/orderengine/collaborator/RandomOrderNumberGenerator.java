package com.comanda.orderengine.collaborator;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Order numbers of the form {@code yyyyMMdd-LOC4-NNNN}: the date, the first four characters of the
 * location id upper-cased and a random number from 1 to 9999.
 */
public class RandomOrderNumberGenerator implements OrderNumberGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Clock clock;

    public RandomOrderNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String next(String locationId) {
        String location = locationId == null || locationId.isBlank() ? "XXXX" : locationId;
        location = location.length() > 4 ? location.substring(0, 4) : location;
        int sequence = ThreadLocalRandom.current().nextInt(1, 10_000);
        return "%s-%s-%04d"
                .formatted(LocalDate.now(clock).format(DATE), location.toUpperCase(Locale.ROOT), sequence);
    }
}
