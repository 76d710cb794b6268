package io.jobkeeper.core;

public enum ScheduleKind {
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    INTERVAL {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
