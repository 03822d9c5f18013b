package com.aigreentick.services.marketing.audience.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.audience.service.AudienceClientService;

@ExtendWith(MockitoExtension.class)
class AudienceResolverTest {

    @Mock
    private AudienceClientService audienceClientService;

    @InjectMocks
    private AudienceResolver resolver;

    @Test
    void trimsDropsBlanksAndKeepsFirstOccurrence() {
        when(audienceClientService.findPhones(any())).thenReturn(Arrays.asList(
                "919800000002", " 919800000001", null, "", "919800000002", "919800000001 ", "919800000003"));

        List<String> phones = resolver.resolve(AudienceFilter.builder().city("Pune").build());

        assertThat(phones).containsExactly("919800000002", "919800000001", "919800000003");
    }

    @Test
    void malformedAndOverlongValuesAreDropped() {
        when(audienceClientService.findPhones(any())).thenReturn(List.of(
                "919800000001", "call-me", "12345", "+9198000000000000000000", "+919800000002"));

        List<String> phones = resolver.resolve(AudienceFilter.everyone());

        assertThat(phones).containsExactly("919800000001", "+919800000002");
    }

    @Test
    void missingFilterMeansEveryoneSubscribed() {
        when(audienceClientService.findPhones(any())).thenReturn(List.of());

        assertThat(resolver.resolve(null)).isEmpty();

        ArgumentCaptor<AudienceFilter> filter = ArgumentCaptor.forClass(AudienceFilter.class);
        verify(audienceClientService).findPhones(filter.capture());
        assertThat(filter.getValue().getSubscription()).isEqualTo(AudienceFilter.SUBSCRIBED);
        assertThat(filter.getValue().getCity()).isNull();
    }

    @Test
    void filterValidation() {
        assertThat(AudienceFilter.everyone().validate()).isEmpty();
        assertThat(AudienceFilter.builder().subscription("all").tags(List.of("vip", " ")).build().validate())
                .hasSize(2);
    }
}
