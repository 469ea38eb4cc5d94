package com.travelcrm.global.config;

public class KafkaTopics {

    private KafkaTopics() {}

    public static final String BOOKING_STATUS = "booking-status";
    public static final String PAYMENT_REFUND = "payment-refund";
}
