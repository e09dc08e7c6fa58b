package com.nft.market.nft_market.ledger;

import com.nft.market.nft_market.asset.ItemTransfers;
import com.nft.market.nft_market.cache.SaleStore;
import com.nft.market.nft_market.engine.ProceedsSplitter;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.ProceedsSplit;
import com.nft.market.nft_market.entity.Sale;
import com.nft.market.nft_market.entity.SaleStatus;
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
 * Fixed-price sales: listing, purchase, reclaiming unsold stock, cancellation.
 *
 * Purchase flow:
 * 1. Sale must be ACTIVE with enough stock
 * 2. Vault portion debited from the buyer's claimable balance
 * 3. Fee and royalty looked up, remainder computed for the seller
 * 4. External portion collected (exact native value, or token allowance)
 * 5. Fee, royalty and seller proceeds credited to the claim vault
 * 6. Stock decremented, items released to the recipient
 *
 * Listed items sit in custody at this ledger's own address. Every operation
 * is atomic: any failure leaves balances, stock and custody untouched.
 */
@Slf4j
public class SaleLedger {

    private final String address;
    private final SaleStore saleStore;
    private final ClaimVault claimVault;
    private final EligibilityRegistry eligibilityRegistry;
    private final ProceedsSplitter proceedsSplitter;
    private final ItemTransfers itemTransfers;
    private final PaymentGateway paymentGateway;
    private final AccessPolicy accessPolicy;
    private final LedgerExecutor executor;

    @Builder
    public SaleLedger(String address, SaleStore saleStore, ClaimVault claimVault,
            EligibilityRegistry eligibilityRegistry, ProceedsSplitter proceedsSplitter,
            ItemTransfers itemTransfers, PaymentGateway paymentGateway, AccessPolicy accessPolicy,
            LedgerExecutor executor) {
        this.address = Addresses.normalize(address);
        this.saleStore = saleStore;
        this.claimVault = claimVault;
        this.eligibilityRegistry = eligibilityRegistry;
        this.proceedsSplitter = proceedsSplitter;
        this.itemTransfers = itemTransfers;
        this.paymentGateway = paymentGateway;
        this.accessPolicy = accessPolicy;
        this.executor = executor;
    }

    /**
     * List amount units of an item at price per unit.
     *
     * @return the new sale id
     */
    public long createSale(CallContext ctx, ItemRef item, long amount, long startTime, long endTime,
            Money price, String currency) {
        ListingChecks.requireItem(item);
        if (price == null || currency == null) {
            throw MarketplaceException.invalidParameters("Price and currency are required");
        }
        ItemRef listed = ItemRef.of(item.getContract(), item.getItemId(), item.getStandard());
        String saleCurrency = Addresses.normalize(currency);
        String seller = ctx.getCaller();

        return executor.execute("createSale", unitOfWork -> {
            ListingChecks.requireEligible(eligibilityRegistry, itemTransfers, address, listed, saleCurrency);
            ListingChecks.requireWindow(startTime, endTime);
            if (amount <= 0) {
                throw MarketplaceException.invalidParameters("Sale amount must be positive: %d", amount);
            }
            if (!itemTransfers.forItem(listed).isValidQuantity(amount)) {
                throw MarketplaceException.invalidParameters(
                        "Amount %d not allowed for %s items", amount, listed.getStandard());
            }

            Sale sale = saleStore.create(unitOfWork, Sale.builder()
                    .item(listed)
                    .seller(seller)
                    .price(price)
                    .currency(saleCurrency)
                    .amount(amount)
                    .startTime(startTime)
                    .endTime(endTime)
                    .createdAt(unitOfWork.now())
                    .build());

            itemTransfers.deposit(unitOfWork, listed, seller, address, amount);

            log.info("Sale created: saleId={}, seller={}, item={}, amount={}, price={}, currency={}",
                    sale.getId(), seller, listed, amount, price, saleCurrency);
            return sale.getId();
        });
    }

    /**
     * Buy quantity units, paying amountFromBalance out of the buyer's claimable
     * balance and the rest externally. Items go to recipient (the buyer when null).
     */
    public boolean buy(CallContext ctx, long saleId, String recipient, long quantity, Money amountFromBalance) {
        String buyer = ctx.getCaller();
        String to = recipient == null ? buyer : Addresses.normalize(recipient);
        Money fromBalance = amountFromBalance == null ? Money.ZERO : amountFromBalance;

        return executor.execute("buy", unitOfWork -> {
            Sale sale = load(saleId);
            SaleStatus status = statusOf(sale, unitOfWork.now());
            if (status != SaleStatus.ACTIVE) {
                throw MarketplaceException.invalidState("Sale %d is %s, not ACTIVE", saleId, status);
            }
            if (quantity <= 0) {
                throw MarketplaceException.invalidParameters("Quantity must be positive: %d", quantity);
            }
            if (Addresses.isZero(to)) {
                throw MarketplaceException.invalidParameters("Recipient cannot be the zero address");
            }
            if (quantity > sale.getRemaining()) {
                throw MarketplaceException.insufficientFunds(
                        "Sale %d has %d left, requested %d", saleId, sale.getRemaining(), quantity);
            }

            Money gross = sale.getPrice().multiply(quantity);
            if (fromBalance.isGreaterThan(gross)) {
                throw MarketplaceException.insufficientFunds(
                        "Balance portion %s exceeds total price %s", fromBalance, gross);
            }
            String ref = reference(saleId);
            claimVault.debit(unitOfWork, buyer, sale.getCurrency(), fromBalance,
                    VaultTransactionType.SALE_PAYMENT_FROM_BALANCE, ref);

            ProceedsSplit split = proceedsSplitter.split(sale.getItem(), sale.getSeller(), gross);
            paymentGateway.collect(unitOfWork, ctx, sale.getCurrency(), gross.subtract(fromBalance));

            creditProceeds(unitOfWork, split, sale.getCurrency(), ref);
            sale.recordPurchase(buyer, quantity);
            unitOfWork.onRollback(() -> sale.revertPurchase(buyer, quantity));
            saleStore.markModified(unitOfWork, sale);

            itemTransfers.release(sale.getItem(), address, to, quantity);

            log.info("Sale purchase: saleId={}, buyer={}, recipient={}, qty={}, gross={}, fee={}, royalty={}, seller={}",
                    saleId, buyer, to, quantity, gross, split.getFee(), split.getRoyalty(), split.getSellerProceeds());
            return true;
        });
    }

    /**
     * Return unsold stock of a closed sale to its seller. Possible once.
     */
    public void claimSaleNfts(CallContext ctx, long saleId) {
        executor.run("claimSaleNfts", unitOfWork -> {
            Sale sale = load(saleId);
            SaleStatus status = statusOf(sale, unitOfWork.now());
            if (!status.isClosed()) {
                throw MarketplaceException.invalidState("Sale %d is %s, not ENDED or CANCELLED", saleId, status);
            }
            if (!sale.getSeller().equals(ctx.getCaller())) {
                throw MarketplaceException.unauthorized("Only the seller may reclaim items of sale %d", saleId);
            }
            long unsold = sale.getRemaining();
            if (unsold == 0) {
                throw MarketplaceException.invalidState("Sale %d has no unsold items", saleId);
            }

            long purchasedBefore = sale.getPurchased();
            sale.setPurchased(sale.getAmount());
            unitOfWork.onRollback(() -> sale.setPurchased(purchasedBefore));
            saleStore.markModified(unitOfWork, sale);

            itemTransfers.release(sale.getItem(), address, sale.getSeller(), unsold);
            log.info("Sale items reclaimed: saleId={}, seller={}, qty={}", saleId, sale.getSeller(), unsold);
        });
    }

    public void cancelSale(CallContext ctx, long saleId) {
        executor.run("cancelSale", unitOfWork -> {
            Sale sale = load(saleId);
            String caller = ctx.getCaller();
            if (!sale.getSeller().equals(caller) && !accessPolicy.isAdministrator(caller)) {
                throw MarketplaceException.unauthorized("Only the seller or an administrator may cancel sale %d", saleId);
            }
            SaleStatus status = statusOf(sale, unitOfWork.now());
            if (!status.isCancellable()) {
                throw MarketplaceException.invalidState("Sale %d is %s and cannot be cancelled", saleId, status);
            }

            sale.setCancelled(true);
            unitOfWork.onRollback(() -> sale.setCancelled(false));
            saleStore.markModified(unitOfWork, sale);
            log.info("Sale cancelled: saleId={}, by={}", saleId, caller);
        });
    }

    public SaleStatus getSaleStatus(long saleId) {
        return executor.read(() -> statusOf(load(saleId), executor.now()));
    }

    /**
     * Detached copy of the sale record.
     */
    public Sale getSale(long saleId) {
        return executor.read(() -> load(saleId).copy());
    }

    public long purchasedBy(long saleId, String buyer) {
        return executor.read(() -> load(saleId).purchasedBy(Addresses.normalize(buyer)));
    }

    public long getSaleCount() {
        return executor.read(saleStore::count);
    }

    SaleStatus statusOf(Sale sale, long now) {
        if (sale.isCancelled() || !eligibilityRegistry.isApprovedListingContract(address)) {
            return SaleStatus.CANCELLED;
        }
        if (now < sale.getStartTime()) {
            return SaleStatus.PENDING;
        }
        if (now < sale.getEndTime() && sale.getPurchased() < sale.getAmount()) {
            return SaleStatus.ACTIVE;
        }
        if (now >= sale.getEndTime() || sale.getPurchased() == sale.getAmount()) {
            return SaleStatus.ENDED;
        }
        throw new IllegalStateException(String.format(
                "Sale %d in no status: purchased=%d amount=%d now=%d window=[%d,%d)",
                sale.getId(), sale.getPurchased(), sale.getAmount(), now, sale.getStartTime(), sale.getEndTime()));
    }

    private void creditProceeds(UnitOfWork unitOfWork, ProceedsSplit split, String currency, String ref) {
        claimVault.credit(unitOfWork, split.getFeeRecipient(), currency, split.getFee(),
                VaultTransactionType.SALE_FEE, ref);
        claimVault.credit(unitOfWork, split.getArtist(), currency, split.getRoyalty(),
                VaultTransactionType.SALE_ROYALTY, ref);
        claimVault.credit(unitOfWork, split.getSeller(), currency, split.getSellerProceeds(),
                VaultTransactionType.SALE_PROCEEDS, ref);
    }

    private Sale load(long saleId) {
        return saleStore.find(saleId)
                .orElseThrow(() -> MarketplaceException.notFound("Sale %d does not exist", saleId));
    }

    private static String reference(long saleId) {
        return "sale:" + saleId;
    }
}
