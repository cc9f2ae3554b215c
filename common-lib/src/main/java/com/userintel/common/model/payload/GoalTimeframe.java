package com.userintel.common.model.payload;

public enum GoalTimeframe {
    SHORT, MEDIUM, LONG
}
