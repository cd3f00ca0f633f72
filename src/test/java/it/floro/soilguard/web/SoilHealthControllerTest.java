package it.floro.soilguard.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Test end-to-end dell'API con la configurazione reale di application.yml.
 * Ogni test usa un campo diverso: lo storico vive nel contesto condiviso.
 */
@SpringBootTest
@AutoConfigureMockMvc
class SoilHealthControllerTest {

    @Autowired
    private MockMvc mvc;

    private static String reading(String ts, double nitrogen, double ph) {
        return String.format(java.util.Locale.ROOT,
                "{\"timestamp\":\"%s\",\"nitrogen\":%s,\"phosphorus\":25,\"potassium\":200,"
                        + "\"ph\":%s,\"moisture\":60,\"temperature\":27,\"humidity\":75}", ts, nitrogen, ph);
    }

    @Test
    void lowNitrogenBeforePlantingIsScoredAndAmended() throws Exception {
        mvc.perform(post("/api/fields/A1/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reading("2025-06-01T06:00:00Z", 100, 6.0)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fieldId").value("A1"))
                .andExpect(jsonPath("$.stage").value("PRE_PLANTING"))
                .andExpect(jsonPath("$.score").value(89.0))
                .andExpect(jsonPath("$.verdict").value("HEALTHY"))
                .andExpect(jsonPath("$.deficiencies", hasSize(6)))
                .andExpect(jsonPath("$.deficiencies[0].status").value("DEFICIENT"))
                .andExpect(jsonPath("$.recommendation.fertilizerType").value("Neem cake"))
                .andExpect(jsonPath("$.recommendation.quantity").value(1000.0))
                .andExpect(jsonPath("$.recommendation.rationale", contains("nitrogen")));
    }

    @Test
    void impossiblePhIsRejectedWithCategory() throws Exception {
        mvc.perform(post("/api/fields/A2/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reading("2025-06-01T06:00:00Z", 180, 14.5)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_READING"))
                .andExpect(jsonPath("$.parameter").value("pH"));

        mvc.perform(get("/api/fields/A2/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void missingValueIsRejected() throws Exception {
        mvc.perform(post("/api/fields/A3/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timestamp\":\"2025-06-01T06:00:00Z\",\"nitrogen\":180}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("MISSING_FIELD"))
                .andExpect(jsonPath("$.parameter").value("phosphorus"));
    }

    @Test
    void outOfOrderReadingIsRejected() throws Exception {
        mvc.perform(post("/api/fields/A4/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reading("2025-06-01T07:00:00Z", 180, 6.0)))
                .andExpect(status().isOk());

        mvc.perform(post("/api/fields/A4/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reading("2025-06-01T06:00:00Z", 180, 6.0)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("OUT_OF_ORDER_READING"));
    }

    @Test
    void trendIsUndefinedUntilTwoRecords() throws Exception {
        mvc.perform(get("/api/fields/A5/trend"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defined").value(false))
                .andExpect(jsonPath("$.slope").value(nullValue()))
                .andExpect(jsonPath("$.records").value(0))
                .andExpect(jsonPath("$.lastReading").value(nullValue()));

        mvc.perform(post("/api/fields/A5/readings").contentType(MediaType.APPLICATION_JSON)
                .content(reading("2025-06-01T06:00:00Z", 180, 6.0))).andExpect(status().isOk());
        mvc.perform(post("/api/fields/A5/readings").contentType(MediaType.APPLICATION_JSON)
                .content(reading("2025-06-01T07:00:00Z", 100, 6.0))).andExpect(status().isOk());

        mvc.perform(get("/api/fields/A5/trend"))
                .andExpect(jsonPath("$.defined").value(true))
                .andExpect(jsonPath("$.slope").value(-11.0))
                .andExpect(jsonPath("$.records").value(2))
                .andExpect(jsonPath("$.lastReading").value("2025-06-01T07:00:00Z"));

        mvc.perform(get("/api/fields/A5/series/nitrogen"))
                .andExpect(jsonPath("$", contains(180.0, 100.0)));
    }

    @Test
    void stageOnlyMovesForward() throws Exception {
        mvc.perform(get("/api/fields/A6/stage"))
                .andExpect(jsonPath("$.stage").value("PRE_PLANTING"));

        mvc.perform(put("/api/fields/A6/stage").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"FLOWERING\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("FLOWERING"));

        mvc.perform(put("/api/fields/A6/stage").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"VEGETATIVE\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("STAGE_REGRESSION"));
    }

    @Test
    void feedEndpointEvaluatesLatestEntry() throws Exception {
        mvc.perform(post("/api/fields/A7/feed").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feeds\":[]}"))
                .andExpect(status().isNoContent());

        mvc.perform(post("/api/fields/A7/feed").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feeds\":[{\"created_at\":\"2025-06-01T06:00:00Z\",\"field1\":\"27\",\"field2\":\"60\","
                                + "\"field3\":\"180\",\"field4\":\"25\",\"field5\":\"200\",\"field6\":\"6.0\",\"field7\":\"70\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(100.0))
                .andExpect(jsonPath("$.recommendation.fertilizerType").value("Maintain current regimen"));
    }

    @Test
    void unknownParameterIsBadRequest() throws Exception {
        mvc.perform(get("/api/fields/A8/series/sulphur"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void exportProducesItalianCsv() throws Exception {
        mvc.perform(post("/api/fields/A9/readings").contentType(MediaType.APPLICATION_JSON)
                .content(reading("2025-06-01T06:00:00Z", 100, 6.0))).andExpect(status().isOk());

        MvcResult result = mvc.perform(get("/export/A9"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("storico_A9_20250601.csv")))
                .andReturn();

        byte[] body = result.getResponse().getContentAsByteArray();
        assertThat(body[0]).isEqualTo((byte) 0xEF);
        String csv = new String(body, 3, body.length - 3, StandardCharsets.UTF_8);
        String[] lines = csv.split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).startsWith("Timestamp (UTC);Campo;Fase").endsWith(";Carenze;Umidità aria (%)");
        assertThat(lines[1]).startsWith("2025-06-01 06:00:00;A9;PRE_PLANTING;100,00;")
                .endsWith(";89,00;HEALTHY;nitrogen 0,50;75,00");
    }
}
