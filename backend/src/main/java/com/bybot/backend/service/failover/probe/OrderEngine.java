package com.bybot.backend.service.failover.probe;

public interface OrderEngine {

    boolean canPlaceOrders();

    void reinitialize();
}
