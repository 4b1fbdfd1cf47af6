package com.overseer.monitor.domain;

/** Actual/target temperature of one heater, keyed by the machine's own heater index. */
public record TemperatureStatus(int heaterIndex, double actual, double target) {}
