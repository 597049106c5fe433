package com.railwise.backend.exception;

/**
 * No schedule is loaded for the requested train number.
 */
public class TrainNotFoundException extends RuntimeException {

    private final String trainNumber;

    public TrainNotFoundException(String trainNumber) {
        super("Train schedule not found: " + trainNumber);
        this.trainNumber = trainNumber;
    }

    public String getTrainNumber() {
        return trainNumber;
    }
}
