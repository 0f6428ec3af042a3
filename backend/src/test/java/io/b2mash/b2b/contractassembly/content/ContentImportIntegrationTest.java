package io.b2mash.b2b.contractassembly.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.contractassembly.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ContentImportIntegrationTest {

  private final UUID editorId = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private ClauseRepository clauseRepository;
  @Autowired private ClauseVersionRepository clauseVersionRepository;
  @Autowired private TemplateRepository templateRepository;

  private static final String LIBRARY =
      """
      {"clauses": [
        {"title": "Honorar", "jurisdiction": "DE", "versions": [
          {"content": "The fee is a flat rate.",
           "rules": [{"type": "requires", "targetClauseTitles": ["Haftung"]}]}]},
        {"title": "Haftung", "jurisdiction": "DE", "versions": [
          {"content": "Liability is capped.",
           "rules": [{"type": "scoped_to", "jurisdictions": ["DE"]}]},
          {"content": "Liability is capped at the fee.",
           "rules": [{"type": "scoped_to", "jurisdictions": ["DE", "AT"]}]}]}
       ],
       "templates": [
        {"title": "Beratungsvertrag", "jurisdiction": "DE",
         "sections": [{"title": "Remuneration", "slots": [
           {"slotId": "fee", "clauseTitle": "Honorar", "type": "required"},
           {"clauseTitle": "Haftung", "type": "optional"}]}],
         "questions": [{"questionId": "billing", "label": "Billing model", "type": "text"}]}
       ]}
      """;

  @Test
  void importCreatesDraftsAndSecondRunSkipsEverything() throws Exception {
    String tenant = "tenant_import_" + UUID.randomUUID().toString().substring(0, 8);

    mockMvc
        .perform(importRequest(tenant, LIBRARY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.summary.clauses.created").value(2))
        .andExpect(jsonPath("$.summary.templates.created").value(1))
        .andExpect(jsonPath("$.summary.questions.created").value(1))
        .andExpect(jsonPath("$.items[0].status").value("created"));

    var liability =
        clauseRepository.findByTenantIdOrderByTitleAsc(tenant).stream()
            .filter(clause -> clause.getTitle().equals("Haftung"))
            .findFirst()
            .orElseThrow();
    assertThat(clauseVersionRepository.findByEntityIdOrderByVersionNumberAsc(liability.getId()))
        .extracting(ClauseVersion::getVersionNumber, ClauseVersion::getStatus)
        .containsExactly(
            tuple(1, VersionStatus.DRAFT),
            tuple(2, VersionStatus.DRAFT));

    mockMvc
        .perform(importRequest(tenant, LIBRARY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.summary.clauses.created").value(0))
        .andExpect(jsonPath("$.summary.clauses.skipped").value(2))
        .andExpect(jsonPath("$.summary.templates.skipped").value(1));
    assertThat(clauseRepository.findByTenantIdOrderByTitleAsc(tenant)).hasSize(2);
  }

  @Test
  void invalidItemRollsBackTheWholeImport() throws Exception {
    String tenant = "tenant_import_" + UUID.randomUUID().toString().substring(0, 8);
    String payload =
        """
        {"clauses": [
          {"title": "Verschwiegenheit", "jurisdiction": "DE", "versions": [
            {"content": "Both parties keep secrets.",
             "rules": [{"type": "scoped_to", "jurisdictions": ["DE"]}]}]}],
         "templates": [
          {"title": "NDA", "jurisdiction": "DE",
           "sections": [{"title": "Main", "slots": [
             {"slotId": "secrecy", "clauseTitle": "Geheimhaltung", "type": "required"}]}]}]}
        """;

    mockMvc
        .perform(importRequest(tenant, payload))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.title").value("Import rejected"))
        .andExpect(jsonPath("$.summary.templates.errors").value(1));

    assertThat(clauseRepository.findByTenantIdOrderByTitleAsc(tenant)).isEmpty();
    assertThat(templateRepository.findByTenantIdOrderByTitleAsc(tenant)).isEmpty();
  }

  private MockHttpServletRequestBuilder importRequest(String tenant, String body) {
    return post("/api/content/import")
        .with(actor(tenant))
        .contentType(MediaType.APPLICATION_JSON)
        .content(body);
  }

  private RequestPostProcessor actor(String tenantId) {
    return request -> {
      request.addHeader("X-Tenant-Id", tenantId);
      request.addHeader("X-Actor-Id", editorId.toString());
      request.addHeader("X-Actor-Role", "editor");
      return request;
    };
  }
}
