package com.trade.coinbase.exchange;

import com.trade.coinbase.core.*;
import com.trade.coinbase.error.ErrorCategory;

import java.util.List;
import java.util.Map;

/**
 * 交易所抽象接口
 * 引擎只通过此接口访问交易所，返回值均为统一格式
 */
public interface Exchange {

    /**
     * 获取交易所名称
     */
    String getName();

    /**
     * 加载交易对信息
     */
    void loadMarkets(boolean reload) throws ExchangeException;

    /**
     * 获取账户ID，失败时返回默认ID
     */
    String getAccountId() throws ExchangeException;

    /**
     * 获取历史K线数据
     * @param symbol 交易对
     * @param timeFrame 周期
     * @param limit 数量限制，null表示单页最大值
     * @param since 开始时间（毫秒），null表示以当前时间结束
     */
    List<Candle> getSymbolPrices(String symbol, TimeFrame timeFrame, Integer limit, Long since) throws ExchangeException;

    /**
     * 获取最近成交
     */
    List<Trade> getRecentTrades(String symbol, int limit) throws ExchangeException;

    /**
     * 获取实时行情
     */
    Ticker getPriceTicker(String symbol) throws ExchangeException;

    /**
     * 获取全部交易对行情
     */
    Map<String, Ticker> getAllCurrenciesPriceTicker() throws ExchangeException;

    /**
     * 下单
     * @return 归一化后的订单
     */
    Order createOrder(OrderRequest request) throws ExchangeException;

    /**
     * 取消订单
     * @return 撤单后的订单状态
     */
    OrderStatus cancelOrder(String exchangeOrderId, String symbol, TraderOrderType orderType) throws ExchangeException;

    /**
     * 获取余额
     */
    Map<String, Balance> getBalance(Map<String, Object> params) throws ExchangeException;

    /**
     * 获取未成交订单
     */
    List<Order> getOpenOrders(String symbol, Long since, Integer limit) throws ExchangeException;

    /**
     * 查询订单
     */
    Order getOrder(String exchangeOrderId, String symbol) throws ExchangeException;

    /**
     * 交易对当前是否接受该类型订单
     */
    boolean isMarketOpenForOrderType(String symbol, TraderOrderType orderType);

    /**
     * 将交易所错误归类，供引擎决定恢复策略
     */
    ErrorCategory classifyError(Throwable error);
}
