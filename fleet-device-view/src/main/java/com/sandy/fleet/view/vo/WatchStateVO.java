package com.sandy.fleet.view.vo;

import com.sandy.fleet.view.service.SubscriptionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatchStateVO {
    private SubscriptionState configurations;
    private SubscriptionState topology;
    private int devices;
    private int configurationSnapshots;
    private String lastError;
}
