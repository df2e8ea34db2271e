package com.familygraph.controller;

import com.familygraph.graph.PersonNotFoundException;
import com.familygraph.model.LineagePathResponse;
import com.familygraph.model.PathNode;
import com.familygraph.model.RelationshipKind;
import com.familygraph.model.RelationshipLink;
import com.familygraph.service.LineagePathService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LineagePathController.class)
class LineagePathControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LineagePathService lineagePathService;

    @Test
    void returnsPath() throws Exception {
        PathNode kamla = new PathNode(2L, "Kamla", "Sharma", 1945, null, "Agra, Uttar Pradesh, India", "",
                null, RelationshipLink.of(1L, RelationshipKind.HUSBAND));
        PathNode ramesh = new PathNode(1L, "Ramesh", "Sharma", 1940, 2010, "", "Hindu",
                RelationshipLink.of(2L, RelationshipKind.WIFE), null);
        when(lineagePathService.findPath(2L, 1L)).thenReturn(
                new LineagePathResponse(true, false, "Connection found", 2L, 2, List.of(kamla, ramesh)));

        mockMvc.perform(get("/api/lineage-path").param("personA", "2").param("personB", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connectionFound").value(true))
                .andExpect(jsonPath("$.personCount").value(2))
                .andExpect(jsonPath("$.path[0].outgoing.label").value("Husband"))
                .andExpect(jsonPath("$.path[1].incoming.label").value("Wife"))
                .andExpect(jsonPath("$.path[1].incoming.relationship").value("WIFE"));
    }

    @Test
    void unknownPersonIsNotFound() throws Exception {
        when(lineagePathService.findPath(2L, 777L)).thenThrow(new PersonNotFoundException(777L));

        mockMvc.perform(get("/api/lineage-path").param("personA", "2").param("personB", "777"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Person not found: 777"));
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/lineage-path").param("personA", "2"))
                .andExpect(status().isBadRequest());
    }
}
