package com.example.demo.lettergen;

import com.example.demo.lettergen.config.LetterTemplateProperties;
import com.example.demo.lettergen.model.GeneratedLetter;
import com.example.demo.lettergen.model.LetterGenerationRequest;
import com.example.demo.lettergen.processor.BlockScanMode;
import com.example.demo.lettergen.processor.ConditionalBlockEliminator;
import com.example.demo.lettergen.service.LetterGenerationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ExtendWith(OutputCaptureExtension.class)
class LetterGenApplicationTests {

    @Autowired
    private LetterGenerationService letterGenerationService;

    @Autowired
    private LetterTemplateProperties properties;

    @Autowired
    private ConditionalBlockEliminator blockEliminator;

    @Test
    void contextLoads() {
        assertNotNull(letterGenerationService);
        assertEquals(BlockScanMode.NESTED, blockEliminator.getMode());
        assertEquals(4, properties.getRequiredFields().size());
        assertEquals(5, properties.getConditionalVariables().size());
    }

    @Test
    void generatesLetterFromBundledTemplate(CapturedOutput output) {
        LetterGenerationRequest request = LetterGenerationRequest.builder()
                .officeName("VALENCIA")
                .build();
        request.getVariables().put("Nombre_Cliente", "Omega");

        GeneratedLetter letter = letterGenerationService.generate(request);

        assertTrue(letter.getFilename().startsWith("Carta_Manifestacion_Omega_"));
        assertTrue(letter.getContent().length > 0);
        assertTrue(output.getOut().contains("Letter Generation took"));
        assertTrue(output.getOut().contains("Letter Request took"));
    }
}
