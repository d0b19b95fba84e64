package com.sandy.fleet.view.transport;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RollbackRequest {
    String name;
    String comment;
}
