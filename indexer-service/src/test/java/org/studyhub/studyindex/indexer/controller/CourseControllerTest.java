package org.studyhub.studyindex.indexer.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.studyhub.studyindex.exception.SearchException;
import org.studyhub.studyindex.indexer.model.CourseIndexRequest;
import org.studyhub.studyindex.indexer.model.IndexingJob;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.indexer.service.CourseContentService;
import org.studyhub.studyindex.indexer.service.IndexingJobService;
import org.studyhub.studyindex.model.SearchResult;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CourseController.class)
class CourseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CourseContentService courseContentService;

    @MockitoBean
    private IndexingJobService indexingJobService;

    @Test
    void blankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/courses/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.resultCount").value(0));

        verifyNoInteractions(courseContentService);
    }

    @Test
    void searchReturnsRankedResults() throws Exception {
        SearchResult hit = SearchResult.builder()
                .id("CS101_L1_0")
                .content("Variables store data values.")
                .metadata(Map.of("course_id", "CS101"))
                .relevanceScore(0.82)
                .build();
        when(courseContentService.search(any(SearchRequest.class))).thenReturn(SearchResponse.builder()
                .query("store data")
                .results(List.of(hit))
                .resultCount(1)
                .build());

        mockMvc.perform(post("/api/courses/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"store data\",\"limit\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resultCount").value(1))
                .andExpect(jsonPath("$.results[0].id").value("CS101_L1_0"))
                .andExpect(jsonPath("$.results[0].relevanceScore").value(0.82));
    }

    @Test
    void indexingIsAccepted() throws Exception {
        when(indexingJobService.startCourseIndexing(any(CourseIndexRequest.class)))
                .thenReturn(new IndexingJob("job-1", IndexingJob.JobKind.COURSE, "CS101"));

        mockMvc.perform(post("/api/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"courseId\":\"CS101\",\"title\":\"Intro\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void storeFailureMapsToBadGateway() throws Exception {
        when(courseContentService.search(any(SearchRequest.class)))
                .thenThrow(new SearchException("Search in 'course-content' failed", null));

        mockMvc.perform(post("/api/courses/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"loops\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("SEARCH_FAILED"))
                .andExpect(jsonPath("$.message").value("Search in 'course-content' failed"));
    }

    @Test
    void invalidIdMapsToBadRequest() throws Exception {
        doThrow(new IllegalArgumentException("courseId is required"))
                .when(courseContentService).deleteCourse(" ");

        mockMvc.perform(delete("/api/courses/{courseId}", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        verify(courseContentService).deleteCourse(" ");
    }
}
