package com.tencent.funcmodel.app.config;

import com.tencent.funcmodel.app.service.FunctionModelAppService;
import com.tencent.funcmodel.app.service.ModelContextAppService;
import com.tencent.funcmodel.client.dto.SingleResponse;
import com.tencent.funcmodel.client.dto.data.FunctionModelDTO;
import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.context.ConflictResolution;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static com.tencent.funcmodel.app.support.AppFixtures.ORDER_FULFILMENT;
import static com.tencent.funcmodel.app.support.AppFixtures.readResource;
import static org.assertj.core.api.Assertions.assertThat;

@SpringJUnitConfig(FunctionModelConfiguration.class)
class FunctionModelConfigurationTest {

    @Autowired
    private FunctionModelProperties properties;

    @Autowired
    private FunctionModelAppService functionModelAppService;

    @Autowired
    private ModelContextAppService modelContextAppService;

    @Test
    void testPropertiesBoundFromClasspath() {
        assertThat(properties.getMaxHierarchyDepth()).isEqualTo(10);
        assertThat(properties.getDefaultConflictResolution()).isEqualTo(ConflictResolution.FIRST_WINS);
        assertThat(properties.getDefaultActionPriority()).isEqualTo(5);
        assertThat(properties.getSimulatedActionDurationMs()).isEqualTo(1000L);
    }

    @Test
    void testServicesAreWired() {
        SingleResponse<FunctionModelDTO> imported = functionModelAppService.importModel(readResource(ORDER_FULFILMENT));

        assertThat(imported.getErrMessage()).isNull();
        assertThat(imported.isSuccess()).isTrue();
        assertThat(imported.getData().getModelId()).hasSize(36);
        assertThat(modelContextAppService.openContext(imported.getData().getModelId()).isSuccess()).isTrue();
    }
}
