package com.memberhub.search.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.DimensionMismatchException;
import com.memberhub.search.index.UpsertCommand;
import com.memberhub.search.index.UpsertResult;
import com.memberhub.search.retrieval.ann.AnnIndexStatus;
import com.memberhub.search.service.ContentIndexService;
import com.memberhub.search.service.IndexStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IndexController.class)
class IndexControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContentIndexService indexService;

    @Test
    void firstUpsertIsCreated() throws Exception {
        when(indexService.upsert(any())).thenReturn(UpsertResult.CREATED);

        mockMvc.perform(put("/index/event/e1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vector\":[0.5,0.5],\"content_text\":\"Gala night\",\"title\":\"Gala\","
                    + "\"tags\":[\"social\"],\"metadata\":{\"city\":\"madrid\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.content_type").value("event"))
            .andExpect(jsonPath("$.content_id").value("e1"))
            .andExpect(jsonPath("$.result").value("created"));

        ArgumentCaptor<UpsertCommand> captor = ArgumentCaptor.forClass(UpsertCommand.class);
        verify(indexService).upsert(captor.capture());
        UpsertCommand command = captor.getValue();
        assertThat(command.key()).isEqualTo(ContentKey.of(ContentType.EVENT, "e1"));
        assertThat(command.vector()).containsExactly(0.5f, 0.5f);
        assertThat(command.contentText()).isEqualTo("Gala night");
        assertThat(command.lexical().getTitle()).isEqualTo("Gala");
        assertThat(command.lexical().getTags()).containsExactly("social");
        assertThat(command.metadata()).containsEntry("city", "madrid");
    }

    @Test
    void vectorOnlyUpsertLeavesLexicalSideAlone() throws Exception {
        when(indexService.upsert(any())).thenReturn(UpsertResult.UNCHANGED);

        mockMvc.perform(put("/index/member-profile/m1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vector\":[1,0]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content_type").value("member_profile"))
            .andExpect(jsonPath("$.result").value("unchanged"));

        ArgumentCaptor<UpsertCommand> captor = ArgumentCaptor.forClass(UpsertCommand.class);
        verify(indexService).upsert(captor.capture());
        assertThat(captor.getValue().lexical()).isNull();
    }

    @Test
    void dimensionMismatchIsBadRequest() throws Exception {
        when(indexService.upsert(any())).thenThrow(new DimensionMismatchException(1536, 10));

        mockMvc.perform(put("/index/article/a1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vector\":[1,2,3,4,5,6,7,8,9,10]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("dimension_mismatch"));
    }

    @Test
    void unknownContentTypeIsRejected() throws Exception {
        mockMvc.perform(put("/index/podcast/p1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Episode\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
        verifyNoInteractions(indexService);
    }

    @Test
    void deleteReportsRemoval() throws Exception {
        when(indexService.remove(ContentKey.of(ContentType.DOCUMENT, "d1"))).thenReturn(true);

        mockMvc.perform(delete("/index/document/d1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(true));
        mockMvc.perform(delete("/index/document/d2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(false));
    }

    @Test
    void statusExposesIndexAndAnnState() throws Exception {
        Map<ContentType, Integer> byType = new LinkedHashMap<>();
        byType.put(ContentType.EVENT, 2);
        byType.put(ContentType.FAQ, 1);
        AnnIndexStatus ann = new AnnIndexStatus(true, false, 4L, 2, 1, null, 15L, null);
        when(indexService.status()).thenReturn(new IndexStatus(1536, 3, byType, 2, 3, ann));

        mockMvc.perform(get("/index/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dimension").value(1536))
            .andExpect(jsonPath("$.items_by_type.event").value(2))
            .andExpect(jsonPath("$.lexical_documents").value(3))
            .andExpect(jsonPath("$.ann.generation").value(4))
            .andExpect(jsonPath("$.ann.pending_vectors").value(1))
            .andExpect(jsonPath("$.ann.last_build_ms").value(15));
    }

    @Test
    void rebuildIsAccepted() throws Exception {
        when(indexService.rebuild()).thenReturn(true);

        mockMvc.perform(post("/index/rebuild"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.triggered").value(true));
    }
}
