package com.spacebooking.scheduling.config;

import com.spacebooking.scheduling.domain.model.ResourceType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured settings under {@code scheduling.*}. Defaults below apply when application.yml is silent.
 */
@Data
@ConfigurationProperties(prefix = "scheduling")
public class SchedulingProperties {

    private Scoring scoring = new Scoring();
    private Resolver resolver = new Resolver();
    private Generation generation = new Generation();
    private Optimizer optimizer = new Optimizer();
    private Supply supply = new Supply();
    private List<PolicyDefinition> policies = new ArrayList<>();

    @Data
    public static class Scoring {
        private int baseScore = 50;
        private List<HourWindow> peakWindows = new ArrayList<>(List.of(new HourWindow(9, 11), new HourWindow(14, 16)));
        private int peakBonus = 30;
        private List<HourWindow> lowValueWindows = new ArrayList<>(List.of(new HourWindow(12, 14)));
        private int lowValuePenalty = 20;
        private int longDurationMinutes = 120;
        private int longDurationBonus = 15;
    }

    /**
     * Hour range with both ends included: {@code 9-11} covers start hours 9, 10 and 11.
     */
    @Data
    @NoArgsConstructor
    public static class HourWindow {
        private int fromHour;
        private int toHour;

        public HourWindow(int fromHour, int toHour) {
            this.fromHour = fromHour;
            this.toHour = toHour;
        }

        public boolean contains(int hour) {
            return hour >= fromHour && hour <= toHour;
        }
    }

    @Data
    public static class Resolver {
        private List<Integer> timeShifts = new ArrayList<>(List.of(-60, -30, 30, 60, 90));
        private int horizonDays = 7;
        private int maxAlternatives = 5;
        private int proximityPenaltyPerHour = 5;
        private int exactDurationBonus = 20;
        private String searchOpen = "09:00";
        private String searchClose = "18:00";
        private int searchStepMinutes = 30;
        private int maxOptimalTimes = 10;
    }

    @Data
    public static class Generation {
        private int slotDurationMinutes = 60;
        private int breakMinutes = 15;
        private int maxSlotsPerDay = 12;
        private Map<ResourceType, Hours> defaultHours = defaultHoursByType();
        private Hours fallbackHours = new Hours("09:00", "18:00");

        private static Map<ResourceType, Hours> defaultHoursByType() {
            Map<ResourceType, Hours> hours = new EnumMap<>(ResourceType.class);
            hours.put(ResourceType.MEETING_ROOM, new Hours("08:00", "20:00"));
            hours.put(ResourceType.PRIVATE_OFFICE, new Hours("08:00", "20:00"));
            hours.put(ResourceType.SHARED_DESK, new Hours("07:00", "22:00"));
            hours.put(ResourceType.EVENT_SPACE, new Hours("08:00", "23:59"));
            hours.put(ResourceType.OTHER, new Hours("09:00", "18:00"));
            return hours;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Hours {
        private String open;
        private String close;

        public Hours(String open, String close) {
            this.open = open;
            this.close = close;
        }
    }

    @Data
    public static class Optimizer {
        private double lowDemandThreshold = 0.2;
        private int usageLookbackDays = 28;
    }

    @Data
    public static class Supply {
        private boolean enabled = false;
        private int horizonDays = 14;
        private String cron = "0 0 2 * * *";
        private List<String> resources = new ArrayList<>();
    }

    /**
     * Configuration form of a booking policy; {@code allowed-days} uses 0 = Sunday.
     */
    @Data
    public static class PolicyDefinition {
        private String name;
        private String type = "GLOBAL";
        private int priority;
        private boolean active = true;
        private String resourceType;
        private String resourceId;
        private String userRole;
        private String membershipLevel;
        private BigDecimal minDurationHours;
        private BigDecimal maxDurationHours;
        private BigDecimal minAdvanceHours;
        private Integer maxAdvanceDays;
        private Integer maxBookingsPerDay;
        private Integer maxBookingsPerWeek;
        private Integer maxBookingsPerMonth;
        private LocalDate effectiveFrom;
        private LocalDate effectiveUntil;
        private Set<Integer> allowedDays;
        private LocalTime allowedStartTime;
        private LocalTime allowedEndTime;
        private boolean blockWeekends;
    }
}
