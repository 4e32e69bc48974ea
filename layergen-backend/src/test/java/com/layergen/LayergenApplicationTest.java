package com.layergen;

import com.layergen.oracle.CodeSynthesisClient;
import com.layergen.service.CodegenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class LayergenApplicationTest {

    @Autowired
    private CodegenService codegenService;

    @Autowired
    private CodeSynthesisClient synthesisClient;

    @Test
    void contextWiresPipelineWithoutDatabase() {
        assertThat(codegenService.status().isInProgress()).isFalse();
        assertThat(synthesisClient).isNotNull();
    }
}
