package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.Lead;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrmSyncServiceTest {

    @Mock
    private ObjectProvider<CrmSyncClient> clientProvider;
    @Mock
    private CrmSyncClient client;

    @Test
    void skipsLeadsBelowFloorAndConvertsClientFailures() {
        when(clientProvider.getIfAvailable()).thenReturn(client);
        Lead good = Lead.builder("Good Co").score(82.0).build();
        Lead flaky = Lead.builder("Flaky Co").score(61.0).build();
        Lead cold = Lead.builder("Cold Co").score(30.0).build();
        when(client.sync(good)).thenReturn(new CrmSyncResult("Good Co", true, "c-1", List.of("p-1"), "d-1", List.of()));
        when(client.sync(flaky)).thenThrow(new IllegalStateException("crm timeout"));

        List<CrmSyncResult> results = new CrmSyncService(clientProvider, new LeadEngineProperties())
            .sync(List.of(good, flaky, cold));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).success()).isTrue();
        assertThat(results.get(0).dealId()).isEqualTo("d-1");
        assertThat(results.get(1).success()).isFalse();
        assertThat(results.get(1).errors()).containsExactly("crm timeout");
        verify(client, times(2)).sync(any());
    }

    @Test
    void withoutClientEveryQualifiedLeadFails() {
        when(clientProvider.getIfAvailable()).thenReturn(null);

        List<CrmSyncResult> results = new CrmSyncService(clientProvider, new LeadEngineProperties())
            .sync(List.of(Lead.builder("Good Co").score(90.0).build()));

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.success()).isFalse();
            assertThat(result.errors()).containsExactly(CrmSyncResult.NOT_CONFIGURED);
        });
    }
}
