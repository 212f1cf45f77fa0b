package com.indigententerprises.applications.retryhub.infrastructure;

import com.indigententerprises.applications.brokercore.infrastructure.BrokerConsumer;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MessageHandler;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntConsumer;

public final class RetryHubRunner implements Runnable, ApplicationContextAware, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RetryHubRunner.class);

    private final BrokerConsumer brokerConsumer;
    private final MessageHandler messageHandler;
    private final IntConsumer exit;

    private ApplicationContext applicationContext;

    public RetryHubRunner(
            final BrokerConsumer brokerConsumer,
            final MessageHandler messageHandler
    ) {
        this.brokerConsumer = brokerConsumer;
        this.messageHandler = messageHandler;
        this.exit = status -> {
            SpringApplication.exit(applicationContext, () -> status);
            System.exit(status);
        };
    }

    RetryHubRunner(
            final BrokerConsumer brokerConsumer,
            final MessageHandler messageHandler,
            final IntConsumer exit
    ) {
        this.brokerConsumer = brokerConsumer;
        this.messageHandler = messageHandler;
        this.exit = exit;
    }

    @Override
    public void setApplicationContext(final ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void run() {
        try {
            brokerConsumer.consume(messageHandler);
        } catch (TransportException | RuntimeException e) {
            // transport failures are not retried here; restart the instance and re-read from the last commit
            log.error("unexpected error occurred during consumption", e);
            exit.accept(1);
        }
    }

    @Override
    public void destroy() {
        brokerConsumer.shutdown();
    }
}
