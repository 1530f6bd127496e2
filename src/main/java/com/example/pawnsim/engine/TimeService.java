package com.example.pawnsim.engine;

import lombok.Getter;

public class TimeService {

    public static final int TICKS_PER_MINUTE = 10;
    public static final int MINUTES_PER_HOUR = 60;
    public static final int HOURS_PER_DAY = 24;
    public static final int TICKS_PER_HOUR = TICKS_PER_MINUTE * MINUTES_PER_HOUR;
    public static final int TICKS_PER_DAY = TICKS_PER_HOUR * HOURS_PER_DAY;
    public static final int DEFAULT_START_HOUR = 8;

    static final float NIGHT_DECAY_MULTIPLIER = 1.5f;
    static final float SLEEP_DECAY_MULTIPLIER = 2.5f;

    @Getter
    private long tick;

    public TimeService(int startHour) {
        if (startHour < 0 || startHour >= HOURS_PER_DAY) {
            throw new IllegalArgumentException("Start hour must be within 0..23, was " + startHour);
        }
        this.tick = (long) startHour * TICKS_PER_HOUR;
    }

    public void advance() {
        tick++;
    }

    public int getMinute() {
        return (int) ((tick / TICKS_PER_MINUTE) % MINUTES_PER_HOUR);
    }

    public int getHour() {
        return (int) ((tick / TICKS_PER_HOUR) % HOURS_PER_DAY);
    }

    public int getDay() {
        return (int) (tick / TICKS_PER_DAY) + 1;
    }

    /** 22:00 to 06:00. */
    public boolean isNight() {
        int hour = getHour();
        return hour < 6 || hour >= 22;
    }

    /** 23:00 to 06:00. */
    public boolean isSleepTime() {
        int hour = getHour();
        return hour < 6 || hour >= 23;
    }

    /** Fraction of the current day elapsed, 0 at midnight. */
    public float getDayFraction() {
        return (float) (tick % TICKS_PER_DAY) / TICKS_PER_DAY;
    }

    public String getTimeString() {
        return String.format("Day %d, %02d:%02d", getDay(), getHour(), getMinute());
    }

    /** Decay scaling for needs that feel the time of day. */
    public float decayMultiplier(boolean nightSensitive) {
        if (!nightSensitive || !isNight()) {
            return 1f;
        }
        return isSleepTime() ? SLEEP_DECAY_MULTIPLIER : NIGHT_DECAY_MULTIPLIER;
    }
}
