package com.nft.market.nft_market.ledger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.asset.ItemTransfers;
import com.nft.market.nft_market.cache.AuctionStore;
import com.nft.market.nft_market.engine.ProceedsSplitter;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Auction;
import com.nft.market.nft_market.entity.AuctionStatus;
import com.nft.market.nft_market.entity.Bid;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.ProceedsSplit;
import com.nft.market.nft_market.entity.VaultTransaction;
import com.nft.market.nft_market.entity.VaultTransactionType;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.execution.LedgerExecutor;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.payment.PaymentGateway;
import com.nft.market.nft_market.registry.EligibilityRegistry;
import com.nft.market.nft_market.security.AccessPolicy;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * First-price ascending auctions with a reserve, and their escrow.
 *
 * Escrow per currency always equals the sum of standing bids in that
 * currency. Only the highest bidder has a standing bid: being outbid, or the
 * auction being cancelled, moves a bid out of escrow into the bidder's
 * claimable balance at once.
 *
 * Bid ordering: a bid must be strictly greater than the current highest bid,
 * so on equal amounts the earlier bidder keeps the lead.
 */
@Slf4j
public class AuctionLedger {

    /**
     * Auctions always sell a single unit.
     */
    private static final long AUCTION_QUANTITY = 1;

    private final String address;
    private final AuctionStore auctionStore;
    private final ClaimVault claimVault;
    private final EligibilityRegistry eligibilityRegistry;
    private final ProceedsSplitter proceedsSplitter;
    private final ItemTransfers itemTransfers;
    private final PaymentGateway paymentGateway;
    private final AccessPolicy accessPolicy;
    private final LedgerExecutor executor;

    private final Map<String, Money> escrow = new ConcurrentHashMap<>();

    @Builder
    public AuctionLedger(String address, AuctionStore auctionStore, ClaimVault claimVault,
            EligibilityRegistry eligibilityRegistry, ProceedsSplitter proceedsSplitter,
            ItemTransfers itemTransfers, PaymentGateway paymentGateway, AccessPolicy accessPolicy,
            LedgerExecutor executor) {
        this.address = Addresses.normalize(address);
        this.auctionStore = auctionStore;
        this.claimVault = claimVault;
        this.eligibilityRegistry = eligibilityRegistry;
        this.proceedsSplitter = proceedsSplitter;
        this.itemTransfers = itemTransfers;
        this.paymentGateway = paymentGateway;
        this.accessPolicy = accessPolicy;
        this.executor = executor;
    }

    /**
     * @return the new auction id
     */
    public long createAuction(CallContext ctx, ItemRef item, long startTime, long endTime,
            Money reservePrice, String currency) {
        ListingChecks.requireItem(item);
        if (reservePrice == null || currency == null) {
            throw MarketplaceException.invalidParameters("Reserve price and currency are required");
        }
        ItemRef listed = ItemRef.of(item.getContract(), item.getItemId(), item.getStandard());
        String auctionCurrency = Addresses.normalize(currency);
        String seller = ctx.getCaller();

        return executor.execute("createAuction", unitOfWork -> {
            ListingChecks.requireEligible(eligibilityRegistry, itemTransfers, address, listed, auctionCurrency);
            ListingChecks.requireWindow(startTime, endTime);

            Auction auction = auctionStore.create(unitOfWork, Auction.builder()
                    .item(listed)
                    .seller(seller)
                    .reservePrice(reservePrice)
                    .currency(auctionCurrency)
                    .startTime(startTime)
                    .endTime(endTime)
                    .createdAt(unitOfWork.now())
                    .build());

            itemTransfers.deposit(unitOfWork, listed, seller, address, AUCTION_QUANTITY);

            log.info("Auction created: auctionId={}, seller={}, item={}, reserve={}, currency={}",
                    auction.getId(), seller, listed, reservePrice, auctionCurrency);
            return auction.getId();
        });
    }

    /**
     * Raise the caller's standing bid by amountFromBalance (taken from their
     * claimable balance) plus externalFunds (paid in now).
     */
    public void bid(CallContext ctx, long auctionId, Money amountFromBalance, Money externalFunds) {
        String bidder = ctx.getCaller();
        Money fromBalance = amountFromBalance == null ? Money.ZERO : amountFromBalance;
        Money external = externalFunds == null ? Money.ZERO : externalFunds;

        executor.run("bid", unitOfWork -> {
            Auction auction = load(auctionId);
            AuctionStatus status = statusOf(auction, unitOfWork.now());
            if (status != AuctionStatus.ACTIVE) {
                throw MarketplaceException.invalidState("Auction %d is %s, not ACTIVE", auctionId, status);
            }

            String previousBidder = auction.getHighestBidder();
            Money previousHighest = auction.getHighestAmount();
            Money standing = auction.standingAmount(bidder);
            if (standing.isPositive() && !bidder.equals(previousBidder)) {
                throw new IllegalStateException(String.format(
                        "Auction %d: %s holds a standing bid without leading", auctionId, bidder));
            }

            Money newTotal = fromBalance.add(external).add(standing);
            if (!newTotal.isGreaterThan(previousHighest)) {
                throw MarketplaceException.insufficientFunds(
                        "Bid %s must exceed highest bid %s on auction %d", newTotal, previousHighest, auctionId);
            }
            if (newTotal.compareTo(auction.getReservePrice()) < 0) {
                throw MarketplaceException.insufficientFunds(
                        "Bid %s is below reserve %s on auction %d", newTotal, auction.getReservePrice(), auctionId);
            }

            String currency = auction.getCurrency();
            String ref = reference(auctionId);
            claimVault.debit(unitOfWork, bidder, currency, fromBalance, VaultTransactionType.BID_FROM_BALANCE, ref);
            paymentGateway.collect(unitOfWork, ctx, currency, external);

            if (previousBidder != null && !previousBidder.equals(bidder)) {
                setBid(unitOfWork, auction, previousBidder, Money.ZERO, unitOfWork.now());
                claimVault.credit(unitOfWork, previousBidder, currency, previousHighest,
                        VaultTransactionType.OUTBID_REFUND, ref);
            }
            // escrow grows by the net new value at risk
            addEscrow(unitOfWork, currency, newTotal.subtract(previousHighest), ref);

            setBid(unitOfWork, auction, bidder, newTotal, unitOfWork.now());
            auction.setHighestBidder(bidder);
            unitOfWork.onRollback(() -> auction.setHighestBidder(previousBidder));
            auctionStore.markModified(unitOfWork, auction);

            log.info("Bid placed: auctionId={}, bidder={}, total={}, fromBalance={}, external={}, outbid={}",
                    auctionId, bidder, newTotal, fromBalance, external,
                    previousBidder != null && !previousBidder.equals(bidder) ? previousBidder : "-");
        });
    }

    /**
     * Settle a closed auction, once.
     *
     * If it ended normally with a bid at or above reserve, the winning bid
     * leaves escrow and is split between platform, artist and seller, and the
     * winner receives the item. Otherwise any bid still standing is released
     * to its bidder and the item goes back to the seller.
     *
     * Callable by the winner, the seller or an administrator.
     */
    public void claimAuctionItem(CallContext ctx, long auctionId) {
        executor.run("claimAuctionItem", unitOfWork -> {
            Auction auction = load(auctionId);
            if (auction.isClaimed()) {
                throw MarketplaceException.invalidState("Auction %d has already been settled", auctionId);
            }
            AuctionStatus status = statusOf(auction, unitOfWork.now());
            if (!status.isSettleable()) {
                throw MarketplaceException.invalidState("Auction %d is %s, not ENDED or CANCELLED", auctionId, status);
            }
            String caller = ctx.getCaller();
            String winner = auction.getHighestBidder();
            if (!caller.equals(auction.getSeller()) && !caller.equals(winner)
                    && !accessPolicy.isAdministrator(caller)) {
                throw MarketplaceException.unauthorized(
                        "Only the seller, the highest bidder or an administrator may settle auction %d", auctionId);
            }

            String currency = auction.getCurrency();
            String ref = reference(auctionId);
            Money winningAmount = auction.getHighestAmount();
            boolean sold = status == AuctionStatus.ENDED
                    && winner != null
                    && winningAmount.isPositive()
                    && winningAmount.isGreaterThanOrEqualTo(auction.getReservePrice());

            auction.setClaimed(true);
            unitOfWork.onRollback(() -> auction.setClaimed(false));
            auctionStore.markModified(unitOfWork, auction);

            if (sold) {
                releaseEscrow(unitOfWork, currency, winningAmount, ref);
                setBid(unitOfWork, auction, winner, Money.ZERO, auction.bidOf(winner).getTimestamp());

                ProceedsSplit split = proceedsSplitter.split(auction.getItem(), auction.getSeller(), winningAmount);
                claimVault.credit(unitOfWork, split.getFeeRecipient(), currency, split.getFee(),
                        VaultTransactionType.AUCTION_FEE, ref);
                claimVault.credit(unitOfWork, split.getArtist(), currency, split.getRoyalty(),
                        VaultTransactionType.AUCTION_ROYALTY, ref);
                claimVault.credit(unitOfWork, split.getSeller(), currency, split.getSellerProceeds(),
                        VaultTransactionType.AUCTION_PROCEEDS, ref);

                itemTransfers.release(auction.getItem(), address, winner, AUCTION_QUANTITY);
                log.info("Auction settled: auctionId={}, winner={}, amount={}, fee={}, royalty={}, seller={}",
                        auctionId, winner, winningAmount, split.getFee(), split.getRoyalty(), split.getSellerProceeds());
            } else {
                if (winner != null && winningAmount.isPositive()) {
                    refundStandingBid(unitOfWork, auction, VaultTransactionType.RESERVE_NOT_MET_REFUND);
                }
                itemTransfers.release(auction.getItem(), address, auction.getSeller(), AUCTION_QUANTITY);
                log.info("Auction closed unsold: auctionId={}, status={}, item returned to {}",
                        auctionId, status, auction.getSeller());
            }
        });
    }

    /**
     * Cancel a pending or active auction; the standing bid, if any, becomes
     * claimable by its bidder.
     */
    public void cancelAuction(CallContext ctx, long auctionId) {
        executor.run("cancelAuction", unitOfWork -> {
            Auction auction = load(auctionId);
            String caller = ctx.getCaller();
            if (!auction.getSeller().equals(caller) && !accessPolicy.isAdministrator(caller)) {
                throw MarketplaceException.unauthorized(
                        "Only the seller or an administrator may cancel auction %d", auctionId);
            }
            AuctionStatus status = statusOf(auction, unitOfWork.now());
            if (!status.isCancellable()) {
                throw MarketplaceException.invalidState("Auction %d is %s and cannot be cancelled", auctionId, status);
            }

            auction.setCancelled(true);
            unitOfWork.onRollback(() -> auction.setCancelled(false));
            if (auction.getHighestAmount().isPositive()) {
                refundStandingBid(unitOfWork, auction, VaultTransactionType.CANCEL_REFUND);
            }
            auctionStore.markModified(unitOfWork, auction);
            log.info("Auction cancelled: auctionId={}, by={}", auctionId, caller);
        });
    }

    public AuctionStatus getAuctionStatus(long auctionId) {
        return executor.read(() -> statusOf(load(auctionId), executor.now()));
    }

    public Auction getAuction(long auctionId) {
        return executor.read(() -> load(auctionId).copy());
    }

    public Bid getBid(long auctionId, String bidder) {
        return executor.read(() -> load(auctionId).bidOf(Addresses.normalize(bidder)).copy());
    }

    /**
     * @return the highest bidder, or the zero address before the first bid
     */
    public String getHighestBidder(long auctionId) {
        return executor.read(() -> {
            String highest = load(auctionId).getHighestBidder();
            return highest == null ? Addresses.ZERO : highest;
        });
    }

    public Money escrowOf(String currency) {
        return executor.read(() -> escrow.getOrDefault(Addresses.normalize(currency), Money.ZERO));
    }

    public void restoreEscrow(String currency, Money amount) {
        executor.read(() -> escrow.put(Addresses.normalize(currency), amount));
    }

    public Set<String> escrowCurrencies() {
        return Set.copyOf(escrow.keySet());
    }

    public long getAuctionCount() {
        return executor.read(auctionStore::count);
    }

    AuctionStatus statusOf(Auction auction, long now) {
        if (auction.isCancelled() || !eligibilityRegistry.isApprovedListingContract(address)) {
            return AuctionStatus.CANCELLED;
        }
        if (auction.isClaimed()) {
            return AuctionStatus.ENDED_AND_CLAIMED;
        }
        if (now < auction.getStartTime()) {
            return AuctionStatus.PENDING;
        }
        if (now < auction.getEndTime()) {
            return AuctionStatus.ACTIVE;
        }
        return AuctionStatus.ENDED;
    }

    private void refundStandingBid(UnitOfWork unitOfWork, Auction auction, VaultTransactionType type) {
        String bidder = auction.getHighestBidder();
        Money amount = auction.getHighestAmount();
        String ref = reference(auction.getId());
        releaseEscrow(unitOfWork, auction.getCurrency(), amount, ref);
        setBid(unitOfWork, auction, bidder, Money.ZERO, auction.bidOf(bidder).getTimestamp());
        claimVault.credit(unitOfWork, bidder, auction.getCurrency(), amount, type, ref);
    }

    private void setBid(UnitOfWork unitOfWork, Auction auction, String bidder, Money amount, long timestamp) {
        Bid previous = auction.getBids().get(bidder);
        auction.getBids().put(bidder, new Bid(amount, timestamp));
        unitOfWork.onRollback(() -> {
            if (previous == null) {
                auction.getBids().remove(bidder);
            } else {
                auction.getBids().put(bidder, previous);
            }
        });
    }

    private void addEscrow(UnitOfWork unitOfWork, String currency, Money amount, String ref) {
        Money before = escrow.getOrDefault(currency, Money.ZERO);
        setEscrow(unitOfWork, currency, before.add(amount));
        unitOfWork.record(escrowEntry(unitOfWork, currency, VaultTransactionType.BID_ESCROWED, true,
                amount, before.add(amount), ref));
    }

    private void releaseEscrow(UnitOfWork unitOfWork, String currency, Money amount, String ref) {
        Money after = escrow.getOrDefault(currency, Money.ZERO).subtract(amount);
        setEscrow(unitOfWork, currency, after);
        unitOfWork.record(escrowEntry(unitOfWork, currency, VaultTransactionType.ESCROW_RELEASED, false,
                amount, after, ref));
    }

    private void setEscrow(UnitOfWork unitOfWork, String currency, Money value) {
        Money before = escrow.getOrDefault(currency, Money.ZERO);
        escrow.put(currency, value);
        unitOfWork.onRollback(() -> escrow.put(currency, before));
    }

    private static VaultTransaction escrowEntry(UnitOfWork unitOfWork, String currency, VaultTransactionType type,
            boolean credit, Money amount, Money after, String ref) {
        return VaultTransaction.builder()
                .account(Addresses.ZERO)
                .currency(currency)
                .transactionType(type)
                .credit(credit)
                .amount(amount)
                .balanceAfter(after)
                .referenceId(ref)
                .timestamp(unitOfWork.now())
                .build();
    }

    private Auction load(long auctionId) {
        return auctionStore.find(auctionId)
                .orElseThrow(() -> MarketplaceException.notFound("Auction %d does not exist", auctionId));
    }

    private static String reference(long auctionId) {
        return "auction:" + auctionId;
    }
}
