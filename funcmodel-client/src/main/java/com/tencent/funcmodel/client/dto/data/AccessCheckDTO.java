package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessCheckDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean granted;
    private String level;
    private String relationship;

    @Builder.Default
    private List<String> accessibleProperties = new ArrayList<>();

    @Builder.Default
    private List<String> restrictedProperties = new ArrayList<>();

    private String denialReason;
}
