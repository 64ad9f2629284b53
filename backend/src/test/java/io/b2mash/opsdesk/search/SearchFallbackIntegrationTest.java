package io.b2mash.opsdesk.search;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.opsdesk.TestcontainersConfiguration;
import io.b2mash.opsdesk.member.MemberFilter;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Search and cache are unreachable under the test profile, so every read is served by Postgres. */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SearchFallbackIntegrationTest {

  private static final String MEMBER = UUID.randomUUID().toString();

  @Autowired private MockMvc mockMvc;

  @Test
  void shouldServeSearchFromRelationalStoreWhileIndexIsDown() throws Exception {
    var token = "Zephyr" + UUID.randomUUID().toString().replace("-", "");
    var leadId = createLead(token + " Oy");

    mockMvc
        .perform(get("/search/results").param("query", token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.results[0].id").value(leadId))
        .andExpect(jsonPath("$.results[0].entityType").value("LEAD"))
        .andExpect(jsonPath("$.facets.entityTypes.LEAD").value(1));
  }

  @Test
  void shouldFilterAdvancedSearchByStatus() throws Exception {
    var token = "Borealis" + UUID.randomUUID().toString().replace("-", "");
    createLead(token + " Ab");

    advanced(token, "new").andExpect(jsonPath("$.total").value(1));
    advanced(token, "contacted").andExpect(jsonPath("$.total").value(0));
  }

  @Test
  void shouldReportDegradedBackendsButStayOk() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.relational").value(true));
  }

  @Test
  void shouldRejectInvalidPaging() throws Exception {
    mockMvc
        .perform(get("/search/results").param("query", "x").param("size", "0"))
        .andExpect(status().isBadRequest());
  }

  private ResultActions advanced(String keywords, String status) throws Exception {
    return mockMvc
        .perform(
            post("/search/advanced-results")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"keywords\": \"" + keywords + "\", \"statuses\": [\"" + status + "\"]}"))
        .andExpect(status().isOk());
  }

  private String createLead(String companyName) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/sales/leads")
                    .header(MemberFilter.MEMBER_HEADER, MEMBER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"companyName\": \"" + companyName + "\"}"))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id").toString();
  }
}
