package com.traffic.forecast.model;

public class ModelAccuracy {
    private double mape;
    private double rmse;
    private double mae;
    private double r2;
    private double accuracy;

    public ModelAccuracy() {}

    public ModelAccuracy(double mape, double rmse, double mae, double r2, double accuracy) {
        this.mape = mape;
        this.rmse = rmse;
        this.mae = mae;
        this.r2 = r2;
        this.accuracy = accuracy;
    }

    // Getters and Setters
    public double getMape() { return mape; }
    public void setMape(double mape) { this.mape = mape; }

    public double getRmse() { return rmse; }
    public void setRmse(double rmse) { this.rmse = rmse; }

    public double getMae() { return mae; }
    public void setMae(double mae) { this.mae = mae; }

    public double getR2() { return r2; }
    public void setR2(double r2) { this.r2 = r2; }

    public double getAccuracy() { return accuracy; }
    public void setAccuracy(double accuracy) { this.accuracy = accuracy; }

    @Override
    public String toString() {
        return String.format("mape=%.2f rmse=%.3f mae=%.3f r2=%.3f accuracy=%.3f", mape, rmse, mae, r2, accuracy);
    }
}
