package com.ai.assistant.service;

import com.ai.assistant.dto.RetrievedDocument;
import com.ai.assistant.exception.BackendFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestDocumentRetrieverTest {

    private final MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();

    private RestDocumentRetriever retriever(String url) {
        return new RestDocumentRetriever(new RestTemplateBuilder().customizers(customizer), url);
    }

    @Test
    void search_readsResultsArray() {
        RestDocumentRetriever retriever = retriever("http://search.test/query");
        MockRestServiceServer server = customizer.getServer();
        server.expect(requestTo("http://search.test/query"))
                .andExpect(jsonPath("$.query").value("how long do returns take?"))
                .andExpect(jsonPath("$.topK").value(2))
                .andRespond(withSuccess("{\"results\":[{\"content\":\"Returns take 5 days.\",\"source\":\"manual.pdf\",\"score\":0.83},"
                        + "{\"text\":\"Refunds follow.\",\"score\":0.41}]}", MediaType.APPLICATION_JSON));

        List<RetrievedDocument> docs = retriever.search("how long do returns take?", 2);

        assertEquals(2, docs.size());
        assertEquals("Returns take 5 days.", docs.get(0).getContent());
        assertEquals("manual.pdf", docs.get(0).getSource());
        assertEquals(0.83, docs.get(0).getScore(), 1e-9);
        assertEquals("Refunds follow.", docs.get(1).getContent());
        assertNull(docs.get(1).getSource());
    }

    @Test
    void search_acceptsBareArray() {
        RestDocumentRetriever retriever = retriever("http://search.test/query");
        customizer.getServer().expect(requestTo("http://search.test/query"))
                .andRespond(withSuccess("[{\"content\":\"Warranty lasts a year.\"}]", MediaType.APPLICATION_JSON));

        assertEquals("Warranty lasts a year.", retriever.search("warranty", 3).get(0).getContent());
    }

    @Test
    void noUrl_meansNoDocuments() {
        assertTrue(retriever("").search("warranty", 2).isEmpty());
    }

    @Test
    void serverError_isBackendFailure() {
        RestDocumentRetriever retriever = retriever("http://search.test/query");
        customizer.getServer().expect(requestTo("http://search.test/query")).andRespond(withServerError());

        assertThrows(BackendFailureException.class, () -> retriever.search("warranty", 2));
    }
}
