package org.aviator.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CrashEvent {
    private String type;
    private Object payload;
}
