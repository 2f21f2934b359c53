package it.aw.collectionindex.controller;

import it.aw.collectionindex.cache.ThumbnailCache;
import it.aw.collectionindex.cache.ThumbnailData;
import it.aw.collectionindex.cache.ThumbnailSource;
import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.index.CollectionSummaryProjector;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionType;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.NavigationResult;
import it.aw.collectionindex.model.PageRequest;
import it.aw.collectionindex.model.PageResult;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;
import it.aw.collectionindex.service.CollectionService;
import it.aw.collectionindex.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static it.aw.collectionindex.support.TestCollections.collection;
import static it.aw.collectionindex.support.TestCollections.withThumbnailPath;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CollectionIndexController.class)
@ActiveProfiles("test")
class CollectionIndexControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CollectionIndexReader reader;

    @MockBean
    private CollectionService collectionService;

    @MockBean
    private ThumbnailCache thumbnailCache;

    @MockBean
    private ThumbnailSource thumbnailSource;

    @Test
    void listUsesRequestedScopeAndOrder() throws Exception {
        PageRequest request = new PageRequest(2, 50);
        when(reader.getPage(any(IndexScope.class), any(PageRequest.class), any(SortField.class), any(SortDirection.class)))
                .thenReturn(PageResult.of(List.of(CollectionSummaryProjector.project(collection("c1", "A", 0))),
                        request, 51));

        mvc.perform(get("/api/collections")
                        .param("page", "2").param("pageSize", "50")
                        .param("sortBy", "name").param("sortDirection", "asc")
                        .param("type", "zip"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collections[0].id").value("c1"))
                .andExpect(jsonPath("$.totalPages").value(2))
                .andExpect(jsonPath("$.hasPrevious").value(true));

        verify(reader).getPage(IndexScope.type(CollectionType.ZIP), request, SortField.NAME, SortDirection.ASC);
    }

    @Test
    void invalidParametersAreBadRequests() throws Exception {
        mvc.perform(get("/api/collections").param("pageSize", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
        mvc.perform(get("/api/collections").param("sortBy", "colore"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/collections/count").param("libraryId", "lib-1").param("type", "zip"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reader);
    }

    @Test
    void storeOutageIsServiceUnavailable() throws Exception {
        when(reader.getCount(IndexScope.global())).thenThrow(new StoreUnavailableException("timeout"));

        mvc.perform(get("/api/collections/count"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void navigationOfUnindexedCollectionIsNotAnError() throws Exception {
        when(reader.getNavigation("ghost", SortField.UPDATED_AT, SortDirection.DESC, IndexScope.global()))
                .thenReturn(NavigationResult.notFound(12));

        mvc.perform(get("/api/collections/ghost/navigation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false))
                .andExpect(jsonPath("$.totalCollections").value(12));
    }

    @Test
    void summaryIsNotFoundWhenNotIndexed() throws Exception {
        when(reader.getSummary("ghost")).thenReturn(Optional.empty());

        mvc.perform(get("/api/collections/ghost")).andExpect(status().isNotFound());
    }

    @Test
    void thumbnailMissIsLoadedAndCached() throws Exception {
        Collection c = withThumbnailPath(collection("c1", "A", 0), "c1.png");
        ThumbnailData data = new ThumbnailData(new byte[] {9, 8, 7}, "image/png");
        when(thumbnailCache.get("c1")).thenReturn(Optional.empty());
        when(collectionService.findById("c1")).thenReturn(Optional.of(c));
        when(thumbnailSource.load(c)).thenReturn(Optional.of(data));

        mvc.perform(get("/api/collections/c1/thumbnail"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(new byte[] {9, 8, 7}));

        verify(thumbnailCache).put("c1", data);
    }

    @Test
    void thumbnailHitSkipsSource() throws Exception {
        when(thumbnailCache.get("c1")).thenReturn(Optional.of(new ThumbnailData(new byte[] {1}, "image/jpeg")));

        mvc.perform(get("/api/collections/c1/thumbnail")).andExpect(status().isOk());

        verify(collectionService, never()).findById(any());
    }

    @Test
    void putSavesCollectionWithPathId() throws Exception {
        when(collectionService.save(any(Collection.class))).thenAnswer(inv -> inv.getArgument(0));

        mvc.perform(put("/api/collections/abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Vacanze\",\"path\":\"/media/vacanze\",\"type\":\"ZIP\"," +
                                "\"imageCount\":12,\"tags\":[\"mare\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("abc"));

        ArgumentCaptor<Collection> saved = ArgumentCaptor.forClass(Collection.class);
        verify(collectionService).save(saved.capture());
        assertThat(saved.getValue().type()).isEqualTo(CollectionType.ZIP);
        assertThat(saved.getValue().imageCount()).isEqualTo(12);
        assertThat(saved.getValue().tags()).containsExactly("mare");
    }

    @Test
    void deleteMapsExistenceToStatus() throws Exception {
        when(collectionService.delete("a")).thenReturn(true);
        when(collectionService.delete("b")).thenReturn(false);

        mvc.perform(delete("/api/collections/a")).andExpect(status().isNoContent());
        mvc.perform(delete("/api/collections/b")).andExpect(status().isNotFound());
        verify(collectionService).delete(eq("a"));
    }

    @Test
    void deleteDuringStoreOutageIsServiceUnavailable() throws Exception {
        when(collectionService.delete("a")).thenThrow(new StoreUnavailableException("connessione rifiutata"));

        mvc.perform(delete("/api/collections/a"))
                .andExpect(status().isServiceUnavailable());
    }
}
