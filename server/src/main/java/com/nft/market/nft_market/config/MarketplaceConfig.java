package com.nft.market.nft_market.config;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.nft.market.nft_market.asset.AssetGateway;
import com.nft.market.nft_market.asset.InMemoryAssetGateway;
import com.nft.market.nft_market.asset.ItemTransfers;
import com.nft.market.nft_market.cache.AuctionStore;
import com.nft.market.nft_market.cache.SaleStore;
import com.nft.market.nft_market.engine.FeePolicy;
import com.nft.market.nft_market.engine.ProceedsSplitter;
import com.nft.market.nft_market.execution.LedgerExecutor;
import com.nft.market.nft_market.ledger.AuctionLedger;
import com.nft.market.nft_market.ledger.ClaimVault;
import com.nft.market.nft_market.ledger.SaleLedger;
import com.nft.market.nft_market.payment.InMemoryPaymentRails;
import com.nft.market.nft_market.payment.PaymentGateway;
import com.nft.market.nft_market.payment.PaymentRails;
import com.nft.market.nft_market.registry.EligibilityRegistry;
import com.nft.market.nft_market.repositories.AuctionRepository;
import com.nft.market.nft_market.repositories.SaleRepository;
import com.nft.market.nft_market.repositories.VaultTransactionRepository;
import com.nft.market.nft_market.security.AccessPolicy;
import com.nft.market.nft_market.security.ConfiguredAccessPolicy;
import com.nft.market.nft_market.service.ConservationAuditor;
import com.nft.market.nft_market.service.LedgerRecovery;
import com.nft.market.nft_market.service.SnapshotPersister;
import com.nft.market.nft_market.service.VaultJournal;

@Configuration
@EnableConfigurationProperties(MarketplaceProperties.class)
public class MarketplaceConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VaultJournal vaultJournal(SnapshotPersister snapshotPersister) {
        return new VaultJournal(snapshotPersister);
    }

    @Bean
    public LedgerExecutor ledgerExecutor(Clock clock, VaultJournal vaultJournal) {
        return new LedgerExecutor(clock, vaultJournal);
    }

    @Bean
    public FeePolicy feePolicy(MarketplaceProperties properties) {
        MarketplaceProperties.Fee fee = properties.getFee();
        return new FeePolicy(fee.getRate(), fee.getScale(), fee.getRecipient());
    }

    @Bean
    public EligibilityRegistry eligibilityRegistry(MarketplaceProperties properties) {
        MarketplaceProperties.Eligibility eligibility = properties.getEligibility();
        List<String> contracts = new ArrayList<>(eligibility.getListingContracts());
        contracts.add(properties.getSaleLedgerAddress());
        contracts.add(properties.getAuctionLedgerAddress());

        EligibilityRegistry registry = new EligibilityRegistry(contracts, eligibility.getCurrencies());
        if (eligibility.isApproveAllCurrencies()) {
            registry.approveAllCurrencies();
        }
        return registry;
    }

    @Bean
    public AccessPolicy accessPolicy(MarketplaceProperties properties) {
        return new ConfiguredAccessPolicy(properties.getAdmins());
    }

    // Sandbox collaborators; replace these two beans to run against real contracts and rails.
    @Bean
    public InMemoryAssetGateway assetGateway() {
        return new InMemoryAssetGateway();
    }

    @Bean
    public InMemoryPaymentRails paymentRails(MarketplaceProperties properties) {
        return new InMemoryPaymentRails(properties.getTreasuryAddress());
    }

    @Bean
    public ItemTransfers itemTransfers(AssetGateway assetGateway) {
        return ItemTransfers.of(assetGateway);
    }

    @Bean
    public PaymentGateway paymentGateway(PaymentRails paymentRails) {
        return new PaymentGateway(paymentRails);
    }

    @Bean
    public ClaimVault claimVault(LedgerExecutor ledgerExecutor, PaymentGateway paymentGateway) {
        return new ClaimVault(ledgerExecutor, paymentGateway);
    }

    @Bean
    public ProceedsSplitter proceedsSplitter(FeePolicy feePolicy, AssetGateway assetGateway) {
        return new ProceedsSplitter(feePolicy, assetGateway);
    }

    @Bean
    public SaleStore saleStore(SnapshotPersister snapshotPersister) {
        return new SaleStore(snapshotPersister);
    }

    @Bean
    public AuctionStore auctionStore(SnapshotPersister snapshotPersister) {
        return new AuctionStore(snapshotPersister);
    }

    @Bean
    public SaleLedger saleLedger(MarketplaceProperties properties, SaleStore saleStore, ClaimVault claimVault,
            EligibilityRegistry eligibilityRegistry, ProceedsSplitter proceedsSplitter, ItemTransfers itemTransfers,
            PaymentGateway paymentGateway, AccessPolicy accessPolicy, LedgerExecutor ledgerExecutor) {
        return SaleLedger.builder()
                .address(properties.getSaleLedgerAddress())
                .saleStore(saleStore)
                .claimVault(claimVault)
                .eligibilityRegistry(eligibilityRegistry)
                .proceedsSplitter(proceedsSplitter)
                .itemTransfers(itemTransfers)
                .paymentGateway(paymentGateway)
                .accessPolicy(accessPolicy)
                .executor(ledgerExecutor)
                .build();
    }

    @Bean
    public AuctionLedger auctionLedger(MarketplaceProperties properties, AuctionStore auctionStore,
            ClaimVault claimVault, EligibilityRegistry eligibilityRegistry, ProceedsSplitter proceedsSplitter,
            ItemTransfers itemTransfers, PaymentGateway paymentGateway, AccessPolicy accessPolicy,
            LedgerExecutor ledgerExecutor) {
        return AuctionLedger.builder()
                .address(properties.getAuctionLedgerAddress())
                .auctionStore(auctionStore)
                .claimVault(claimVault)
                .eligibilityRegistry(eligibilityRegistry)
                .proceedsSplitter(proceedsSplitter)
                .itemTransfers(itemTransfers)
                .paymentGateway(paymentGateway)
                .accessPolicy(accessPolicy)
                .executor(ledgerExecutor)
                .build();
    }

    @Bean
    public LedgerRecovery ledgerRecovery(SaleRepository saleRepository, AuctionRepository auctionRepository,
            VaultTransactionRepository vaultTransactionRepository, SaleStore saleStore, AuctionStore auctionStore,
            VaultJournal vaultJournal, ClaimVault claimVault, AuctionLedger auctionLedger,
            PaymentGateway paymentGateway) {
        return new LedgerRecovery(saleRepository, auctionRepository, vaultTransactionRepository, saleStore,
                auctionStore, vaultJournal, claimVault, auctionLedger, paymentGateway);
    }

    @Bean
    public ConservationAuditor conservationAuditor(LedgerExecutor ledgerExecutor, ClaimVault claimVault,
            AuctionLedger auctionLedger, PaymentGateway paymentGateway) {
        return new ConservationAuditor(ledgerExecutor, claimVault, auctionLedger, paymentGateway);
    }
}
