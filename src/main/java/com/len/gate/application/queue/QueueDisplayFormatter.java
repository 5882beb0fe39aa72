package com.len.gate.application.queue;

/**
 * 대기열 화면 표시용 문구
 */
public final class QueueDisplayFormatter {

    private QueueDisplayFormatter() {}

    /**
     * 1분 미만 → "Less than 1 minute"
     * 5분 미만 → 올림, 10분 미만 → 5분 단위, 1시간 미만 → 10분 단위
     * 1시간 이상 → 시간 + 남은 분(10분 단위)
     */
    public static String formatWaitTime(double minutes) {
        if (minutes < 1) {
            return "Less than 1 minute";
        }
        if (minutes == 1) {
            return "About 1 minute";
        }
        if (minutes < 5) {
            return "About " + (long) Math.ceil(minutes) + " minutes";
        }
        if (minutes < 10) {
            return "About " + Math.round(minutes / 5) * 5 + " minutes";
        }
        if (minutes < 60) {
            return "About " + Math.round(minutes / 10) * 10 + " minutes";
        }

        long hours = (long) Math.floor(minutes / 60);
        long remaining = Math.round((minutes - hours * 60) / 10) * 10;
        if (remaining >= 60) {
            hours++;
            remaining = 0;
        }

        String hourText = "About " + hours + (hours == 1 ? " hour" : " hours");
        return remaining == 0 ? hourText : hourText + " and " + remaining + " minutes";
    }

    public static String formatQueuePosition(int position) {
        int mod100 = position % 100;
        if (mod100 >= 11 && mod100 <= 13) {
            return position + "th";
        }
        return switch (position % 10) {
            case 1 -> position + "st";
            case 2 -> position + "nd";
            case 3 -> position + "rd";
            default -> position + "th";
        };
    }

    /**
     * 맨 앞이면 100%. 범위는 0~100.
     */
    public static int progressPercentage(int position, long totalWaiting) {
        if (position <= 0 || totalWaiting <= 0) {
            return 100;
        }
        double progress = (double) (totalWaiting - position + 1) / totalWaiting * 100;
        return (int) Math.max(0, Math.min(100, Math.round(progress)));
    }
}
