package io.github.yok.timesheetlink.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A single billable work entry produced from one timesheet row.
 *
 * <p>
 * Instances are immutable. {@link #create} derives {@code total} from hours and rate; instances
 * built through the builder are not checked, the validation rules enforce the relationship.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class WorkItem {

    // Scale of monetary amounts
    public static final int AMOUNT_SCALE = 2;

    String id;

    LocalDate date;

    BigDecimal hours;

    BigDecimal rate;

    String description;

    // hours * rate rounded to cents, half away from zero
    BigDecimal total;

    Instant createdAt;

    /**
     * Creates a work item and computes its total.
     *
     * @param id unique identifier
     * @param date work date
     * @param hours worked hours
     * @param rate hourly rate
     * @param description work description
     * @param createdAt creation timestamp
     * @return new work item
     */
    public static WorkItem create(String id, LocalDate date, BigDecimal hours, BigDecimal rate,
            String description, Instant createdAt) {
        return WorkItem.builder().id(id).date(date).hours(hours).rate(rate)
                .description(description).total(calculateTotal(hours, rate))
                .createdAt(createdAt).build();
    }

    /**
     * Computes {@code hours * rate} rounded to two decimal places.
     *
     * @param hours worked hours
     * @param rate hourly rate
     * @return rounded amount
     */
    public static BigDecimal calculateTotal(BigDecimal hours, BigDecimal rate) {
        return hours.multiply(rate).setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }
}
