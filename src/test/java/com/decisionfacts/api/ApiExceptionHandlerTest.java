package com.decisionfacts.api;

import com.decisionfacts.taxonomy.TaxonomyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.lang.reflect.Method;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiExceptionHandlerTest {

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new FailingController())
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void advice_hasNoTaxonomySpecificHandler() {
        for (Method method : ApiExceptionHandler.class.getDeclaredMethods()) {
            assertFalse(Arrays.asList(method.getParameterTypes()).contains(TaxonomyException.class), method.getName());
        }
    }

    @Test
    void taxonomyDefectAtRequestTime_isInternalError() throws Exception {
        mvc.perform(get("/taxonomy-defect"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error_code").value("INTERNAL_ERROR"))
            .andExpect(jsonPath("$.message").value("an unexpected error occurred"));
    }

    @Test
    void illegalArgument_isInvalidArgument() throws Exception {
        mvc.perform(get("/illegal-argument"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"))
            .andExpect(jsonPath("$.message").value("limit exceeded"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    /** Exercised through the standalone setup; @Controller is required for Spring 6 handler detection. */
    @Controller
    @ResponseBody
    static class FailingController {

        @GetMapping("/taxonomy-defect")
        String taxonomyDefect() {
            throw new TaxonomyException("duplicate pattern id");
        }

        @GetMapping("/illegal-argument")
        String illegalArgument() {
            throw new IllegalArgumentException("limit exceeded");
        }
    }
}
