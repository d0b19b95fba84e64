package com.sandy.fleet.view.transport;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ListModelsRequest {
    boolean verbose;
}
