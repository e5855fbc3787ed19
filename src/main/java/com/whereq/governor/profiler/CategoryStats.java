package com.whereq.governor.profiler;

import lombok.Value;

@Value
public class CategoryStats {
    String category;
    long count;
    double totalMs;
    double totalMemoryMb;
}
