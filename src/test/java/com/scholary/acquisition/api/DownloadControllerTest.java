package com.scholary.acquisition.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.acquisition.gateway.TransferRecord;
import com.scholary.acquisition.transfer.TransferOutcome;
import com.scholary.acquisition.transfer.TransferSelection;
import com.scholary.acquisition.transfer.TransferService;
import com.scholary.acquisition.updates.TransferUpdateHub;
import com.scholary.acquisition.updates.UpdateSubscription;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DownloadController.class)
class DownloadControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private TransferService transferService;
  @MockBean private TransferUpdateHub updateHub;

  @MockBean(name = "streamExecutor")
  private Executor streamExecutor;

  @Test
  void queue_returnsPerFileOutcomes() throws Exception {
    List<TransferSelection> selections =
        List.of(
            new TransferSelection("alice", "A\\01.flac", 10L),
            new TransferSelection("alice", "A\\02.flac", 20L));
    when(transferService.queue("user-1", selections, "/music/Artist"))
        .thenReturn(
            List.of(
                new TransferOutcome("alice", "A\\01.flac", 10L, null),
                new TransferOutcome("alice", "A\\02.flac", 20L, "refused")));

    mockMvc
        .perform(
            post("/api/downloads")
                .header("X-User", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"targetFolder\":\"/music/Artist\",\"items\":["
                        + "{\"username\":\"alice\",\"filename\":\"A\\\\01.flac\",\"size\":10},"
                        + "{\"username\":\"alice\",\"filename\":\"A\\\\02.flac\",\"size\":20}]}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.accepted").value(1))
        .andExpect(jsonPath("$.failed").value(1))
        .andExpect(jsonPath("$.outcomes[1].error").value("refused"));
  }

  @Test
  void queue_withoutUserHeader_isBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/downloads")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"targetFolder\":\"/music\",\"items\":["
                        + "{\"username\":\"alice\",\"filename\":\"a.flac\",\"size\":1}]}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void queue_emptySelection_isBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/downloads")
                .header("X-User", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetFolder\":\"/music\",\"items\":[]}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void current_returnsLatestRecords() throws Exception {
    when(transferService.latest("user-1"))
        .thenReturn(List.of(TransferRecord.queued("alice", "a.flac", 1L)));

    mockMvc
        .perform(get("/api/downloads").header("X-User", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].filename").value("a.flac"))
        .andExpect(jsonPath("$[0].states[0]").value("QUEUED"));
  }

  @Test
  void updates_streamStartedOnStreamPool() throws Exception {
    UpdateSubscription subscription = new TransferUpdateHub(10, 1).subscribe("user-1");
    when(updateHub.subscribe("user-1")).thenReturn(subscription);

    mockMvc
        .perform(get("/api/downloads/updates").header("X-User", "user-1"))
        .andExpect(status().isOk());

    verify(streamExecutor).execute(any());
    assertThat(subscription.isClosed()).isFalse();
  }

  @Test
  void updates_streamPoolFull_isServiceUnavailableAndReleasesSubscription() throws Exception {
    UpdateSubscription subscription = new TransferUpdateHub(10, 1).subscribe("user-1");
    when(updateHub.subscribe("user-1")).thenReturn(subscription);
    doThrow(new TaskRejectedException("stream pool full")).when(streamExecutor).execute(any());

    mockMvc
        .perform(get("/api/downloads/updates").header("X-User", "user-1"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value(503));

    assertThat(subscription.isClosed()).isTrue();
  }

  @Test
  void cancelMonitoring_reportsCount() throws Exception {
    when(transferService.cancelMonitoring("user-1")).thenReturn(2);

    mockMvc
        .perform(post("/api/downloads/monitoring/cancel").header("X-User", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").value(2));
  }

  @Test
  void cancelTransferAndClearCompleted() throws Exception {
    mockMvc
        .perform(delete("/api/downloads/alice/t1").param("remove", "true"))
        .andExpect(status().isNoContent());
    mockMvc.perform(delete("/api/downloads/completed")).andExpect(status().isNoContent());

    verify(transferService).cancelTransfer("alice", "t1", true);
    verify(transferService).clearCompleted();
  }
}
