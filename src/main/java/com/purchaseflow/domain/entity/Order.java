package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseTimeEntity;
import com.purchaseflow.domain.vo.Money;
import com.purchaseflow.domain.vo.OrderStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 주문 Entity
 *
 * 주문 상품과 배송지는 주문이 단방향으로 소유합니다.
 * 주문일/입금일/발송일은 구매 플로우의 프로세서가 상태 전이에 맞춰 기록합니다.
 */
@Entity
@Table(name = "orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseTimeEntity implements ItemHolder {

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "order_status_id", nullable = false)
    private OrderStatus orderStatus;

    @Column(name = "order_date")
    private LocalDateTime orderDate;

    @Column(name = "payment_date")
    private LocalDateTime paymentDate;

    @Column(name = "commit_date")
    private LocalDateTime commitDate;

    @Column(name = "use_point", nullable = false)
    private int usePoint;

    @Column(name = "subtotal", nullable = false)
    private Money subtotal;

    @Column(name = "payment_total", nullable = false)
    private Money paymentTotal;

    @Version
    @Column(name = "version")
    private Long version;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "order_id")
    private List<OrderItem> items = new ArrayList<>();

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "order_id")
    private List<Shipping> shippings = new ArrayList<>();

    public Order(Long customerId, OrderStatus orderStatus) {
        if (orderStatus == null) {
            throw new IllegalArgumentException("주문 상태는 필수입니다");
        }
        this.customerId = customerId;
        this.orderStatus = orderStatus;
        this.subtotal = Money.zero();
        this.paymentTotal = Money.zero();
        initializeTimestamps();
    }

    /**
     * 카트의 상품으로 신규 주문을 만듭니다.
     */
    public static Order fromCart(Cart cart, Long customerId, OrderStatus orderStatus) {
        Order order = new Order(customerId, orderStatus);
        cart.getItems().forEach(item -> order.addItem(OrderItem.from(item)));
        return order;
    }

    @Override
    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public List<Shipping> getShippings() {
        return Collections.unmodifiableList(shippings);
    }

    public void addItem(OrderItem item) {
        this.items.add(item);
    }

    public void addShipping(Shipping shipping) {
        this.shippings.add(shipping);
    }

    public void changeStatus(OrderStatus orderStatus) {
        if (orderStatus == null) {
            throw new IllegalArgumentException("주문 상태는 필수입니다");
        }
        this.orderStatus = orderStatus;
        updateTimestamp();
    }

    public void changeUsePoint(int usePoint) {
        this.usePoint = usePoint;
    }

    public void applyTotals(Money subtotal, Money paymentTotal) {
        this.subtotal = subtotal;
        this.paymentTotal = paymentTotal;
    }

    public void stampOrderDate(LocalDateTime orderDate) {
        this.orderDate = orderDate;
    }

    public void stampPaymentDate(LocalDateTime paymentDate) {
        this.paymentDate = paymentDate;
    }

    public void stampCommitDate(LocalDateTime commitDate) {
        this.commitDate = commitDate;
    }

    @Override
    public Order copy() {
        Order copied = new Order();
        copied.setId(getId());
        copied.copyTimestampsFrom(this);
        copied.customerId = customerId;
        copied.orderStatus = orderStatus;
        copied.orderDate = orderDate;
        copied.paymentDate = paymentDate;
        copied.commitDate = commitDate;
        copied.usePoint = usePoint;
        copied.subtotal = subtotal;
        copied.paymentTotal = paymentTotal;
        copied.version = version;
        items.forEach(item -> copied.items.add(item.copy()));
        shippings.forEach(shipping -> copied.shippings.add(shipping.copy()));
        return copied;
    }
}
