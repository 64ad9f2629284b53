package io.b2mash.opsdesk.sales;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

@Embeddable
public class OfferLineItem {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  @Column(name = "product_name", nullable = false, length = 200)
  private String productName;

  @Column(name = "description", length = 1000)
  private String description;

  @Column(name = "quantity", nullable = false, precision = 12, scale = 2)
  private BigDecimal quantity;

  @Column(name = "unit_price", nullable = false, precision = 14, scale = 2)
  private BigDecimal unitPrice;

  @Column(name = "discount_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal discountPct;

  @Column(name = "vat_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal vatPct;

  protected OfferLineItem() {}

  public OfferLineItem(
      String productName,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal discountPct,
      BigDecimal vatPct) {
    this.productName = Objects.requireNonNull(productName, "productName must not be null");
    this.description = description;
    this.quantity = Objects.requireNonNull(quantity, "quantity must not be null");
    this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice must not be null");
    this.discountPct = discountPct != null ? discountPct : BigDecimal.ZERO;
    this.vatPct = vatPct != null ? vatPct : Offer.DEFAULT_VAT_PCT;
  }

  /** Quantity times unit price, before discount and VAT. */
  public BigDecimal gross() {
    return quantity.multiply(unitPrice);
  }

  public BigDecimal discount() {
    return gross().multiply(discountPct).divide(HUNDRED, 6, RoundingMode.HALF_UP);
  }

  public BigDecimal net() {
    return gross().subtract(discount());
  }

  public BigDecimal vat() {
    return net().multiply(vatPct).divide(HUNDRED, 6, RoundingMode.HALF_UP);
  }

  public String getProductName() {
    return productName;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public BigDecimal getDiscountPct() {
    return discountPct;
  }

  public BigDecimal getVatPct() {
    return vatPct;
  }
}
