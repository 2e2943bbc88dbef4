package com.openforge.taskcore.repair;

public record RepairDecision(boolean shouldRepair, String reason) {

    public static RepairDecision repair(String reason) {
        return new RepairDecision(true, reason);
    }

    public static RepairDecision skip(String reason) {
        return new RepairDecision(false, reason);
    }
}
