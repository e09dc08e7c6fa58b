package com.nft.market.nft_market.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.nft.market.nft_market.engine.FeePolicy;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.registry.EligibilityRegistry;
import com.nft.market.nft_market.security.CallerTokenService;
import com.nft.market.nft_market.service.MarketAdminService;
import com.nft.market.nft_market.web.AdminController;

@WebMvcTest(controllers = AdminController.class)
@Import({ SecurityConfig.class, SecurityConfigTest.Beans.class })
@TestPropertySource(properties = {
        "marketplace.auth.token-secret=test-secret-0123456789abcdef0123456789",
        "marketplace.rate-limit.limit-for-period=100" })
class SecurityConfigTest {

    private static final String ADMIN = "0xad01000000000000000000000000000000000005";

    @TestConfiguration
    @EnableConfigurationProperties(MarketplaceProperties.class)
    static class Beans {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CallerTokenService callerTokenService;

    @MockBean
    private MarketAdminService adminService;

    @MockBean
    private FeePolicy feePolicy;

    @MockBean
    private EligibilityRegistry eligibilityRegistry;

    @Test
    void readsArePublic() throws Exception {
        when(feePolicy.getFeeRecipient()).thenReturn(ADMIN);

        mockMvc.perform(get("/admin/fee")).andExpect(status().isOk());
    }

    @Test
    void forgedCallerHeaderCannotWrite() throws Exception {
        mockMvc.perform(put("/admin/fee").header("X-Caller-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"rate\":0,\"scale\":100}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(adminService);
    }

    @Test
    void signedTokenReachesTheService() throws Exception {
        when(adminService.setFee(any(CallContext.class), anyLong(), anyLong())).thenReturn(true);

        mockMvc.perform(put("/admin/fee").header("Authorization", "Bearer " + callerTokenService.issue(ADMIN))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"rate\":0,\"scale\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));

        verify(adminService).setFee(any(CallContext.class), anyLong(), anyLong());
    }
}
