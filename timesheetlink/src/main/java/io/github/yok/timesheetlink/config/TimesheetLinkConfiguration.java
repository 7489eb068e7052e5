package io.github.yok.timesheetlink.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that registers the timesheet parser, validator and import service.
 *
 * <p>
 * Components are picked up by scanning the {@code io.github.yok.timesheetlink} package.
 * {@link TimesheetProperties} is bound from the {@code timesheet} prefix. The {@link Clock} bean
 * is the only collaborator without a component class; replace it to control the notion of "today"
 * used by date inference and validation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackages = "io.github.yok.timesheetlink")
public class TimesheetLinkConfiguration {

    /**
     * Provides the clock used for year inference, date validation and work item timestamps.
     *
     * @return system clock in the default time zone
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
