package com.athena.canaryservice.state;

import lombok.Value;

@Value
public class Promotion {
    String previousStablePath;
    String newStablePath;
}
