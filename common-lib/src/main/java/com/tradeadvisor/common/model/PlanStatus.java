package com.tradeadvisor.common.model;

/**
 * Terminal outcome of a successful run.
 *
 * <ul>
 *   <li>COMPLETE   : setup and a non-zero position size</li>
 *   <li>UNSIZEABLE : setup is valid but the risk budget buys less than one unit</li>
 *   <li>NO_TRADE   : the analyst short-circuited the pipeline</li>
 * </ul>
 */
public enum PlanStatus {
    COMPLETE,
    UNSIZEABLE,
    NO_TRADE
}
