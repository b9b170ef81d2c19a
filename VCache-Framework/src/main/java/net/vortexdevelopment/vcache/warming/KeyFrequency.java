package net.vortexdevelopment.vcache.warming;

import lombok.Value;

@Value
public class KeyFrequency {
    String key;
    int accessCount;
}
