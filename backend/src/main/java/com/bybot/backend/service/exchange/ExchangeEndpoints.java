package com.bybot.backend.service.exchange;

import com.bybot.backend.service.ratelimit.RateLimitKeys;
import org.springframework.http.HttpMethod;

import java.util.Map;
import java.util.Optional;

/**
 * Method name to v5 REST route table.
 */
public final class ExchangeEndpoints {

    public static final String GET_SERVER_TIME = "get_server_time";
    public static final String GET_TICKERS = "get_tickers";
    public static final String GET_KLINE = "get_kline";
    public static final String GET_WALLET_BALANCE = "get_wallet_balance";
    public static final String GET_POSITIONS = "get_positions";
    public static final String GET_OPEN_ORDERS = "get_open_orders";
    public static final String PLACE_ORDER = "place_order";
    public static final String CANCEL_ORDER = "cancel_order";
    public static final String SET_LEVERAGE = "set_leverage";

    public record Route(HttpMethod httpMethod, String path, boolean signed, String rateLimitKey) {}

    private static final Map<String, Route> ROUTES = Map.of(
            GET_SERVER_TIME, new Route(HttpMethod.GET, "/v5/market/time", false, RateLimitKeys.MARKET),
            GET_TICKERS, new Route(HttpMethod.GET, "/v5/market/tickers", false, RateLimitKeys.MARKET),
            GET_KLINE, new Route(HttpMethod.GET, "/v5/market/kline", false, RateLimitKeys.MARKET),
            GET_WALLET_BALANCE, new Route(HttpMethod.GET, "/v5/account/wallet-balance", true, RateLimitKeys.ACCOUNT),
            GET_POSITIONS, new Route(HttpMethod.GET, "/v5/position/list", true, RateLimitKeys.POSITION),
            GET_OPEN_ORDERS, new Route(HttpMethod.GET, "/v5/order/realtime", true, RateLimitKeys.ORDER),
            PLACE_ORDER, new Route(HttpMethod.POST, "/v5/order/create", true, RateLimitKeys.ORDER),
            CANCEL_ORDER, new Route(HttpMethod.POST, "/v5/order/cancel", true, RateLimitKeys.ORDER),
            SET_LEVERAGE, new Route(HttpMethod.POST, "/v5/position/set-leverage", true, RateLimitKeys.POSITION)
    );

    private ExchangeEndpoints() {
    }

    public static Optional<Route> find(String method) {
        return Optional.ofNullable(method).map(ROUTES::get);
    }

    public static String rateLimitKey(String method) {
        return find(method).map(Route::rateLimitKey).orElse(RateLimitKeys.DEFAULT);
    }
}
