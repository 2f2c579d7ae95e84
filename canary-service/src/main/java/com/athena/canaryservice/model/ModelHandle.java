package com.athena.canaryservice.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A model together with the artifact path it was loaded from.
 */
@Value
public class ModelHandle {
    @NonNull String path;
    @NonNull PredictiveModel model;
}
