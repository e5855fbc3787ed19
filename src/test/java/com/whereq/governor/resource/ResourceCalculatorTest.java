package com.whereq.governor.resource;

import com.whereq.governor.model.ResourceRequirement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("ResourceCalculator")
class ResourceCalculatorTest {

    private final ResourceCalculator calculator = new ResourceCalculator();

    @Test
    @DisplayName("reads cpu, memory and accelerator memory from the perf section")
    void readsPerfSection() {
        ResourceRequirement requirement = calculator.calculate(Map.of("perf", Map.of(
            "cpu_percent", 25,
            "ram_mb", "2g",
            "vram_mb", 1024)));

        assertEquals(25.0, requirement.getCpuPercent());
        assertEquals(2048.0, requirement.getMemMb());
        assertEquals(1024.0, requirement.getAccelMemMb());
    }

    @Test
    @DisplayName("accepts the alternative key names")
    void aliases() {
        ResourceRequirement requirement = calculator.calculate(Map.of("perf", Map.of(
            "cpu", "12.5%",
            "memory_mb", 512,
            "gpu_mem_mb", "1g")));

        assertEquals(12.5, requirement.getCpuPercent());
        assertEquals(512.0, requirement.getMemMb());
        assertEquals(1024.0, requirement.getAccelMemMb());
    }

    @Test
    @DisplayName("clamps negative values to zero")
    void clampsNegatives() {
        ResourceRequirement requirement = calculator.calculate(Map.of("perf", Map.of(
            "cpu_percent", -5,
            "mem_mb", -100)));

        assertEquals(0.0, requirement.getCpuPercent());
        assertEquals(0.0, requirement.getMemMb());
    }

    @Test
    @DisplayName("returns no cost without a perf section")
    void missingPerf() {
        assertSame(ResourceRequirement.NONE, calculator.calculate(Map.of("name", "job")));
        assertSame(ResourceRequirement.NONE, calculator.calculate(null));
    }

    @Test
    @DisplayName("parses memory strings with units")
    void parseMemory() {
        assertEquals(2048.0, calculator.parseMemory("2g"));
        assertEquals(512.0, calculator.parseMemory("512m"));
        assertEquals(512.0, calculator.parseMemory("512MB"));
        assertEquals(2.0, calculator.parseMemory("2048k"));
        assertEquals(300.0, calculator.parseMemory("300"));
        assertEquals(0.0, calculator.parseMemory("lots"));
        assertEquals(0.0, calculator.parseMemory(null));
    }
}
