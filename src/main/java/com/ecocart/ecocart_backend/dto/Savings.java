package com.ecocart.ecocart_backend.dto;

public class Savings {

    private double economic;
    private double carbon;
    private int percentage;

    public Savings() {
    }

    public Savings(double economic, double carbon, int percentage) {
        this.economic = economic;
        this.carbon = carbon;
        this.percentage = percentage;
    }

    public double getEconomic() {
        return economic;
    }

    public void setEconomic(double economic) {
        this.economic = economic;
    }

    public double getCarbon() {
        return carbon;
    }

    public void setCarbon(double carbon) {
        this.carbon = carbon;
    }

    public int getPercentage() {
        return percentage;
    }

    public void setPercentage(int percentage) {
        this.percentage = percentage;
    }
}
