package net.leasehold.core.spi;

import java.util.concurrent.Callable;

public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 연다 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션과 무관하게 새 트랜잭션에서 실행 */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
