package com.ecocart.ecocart_backend.dto;

public class DietaryRestrictions {

    private boolean vegan;
    private boolean glutenFree;

    public DietaryRestrictions() {
    }

    public DietaryRestrictions(boolean vegan, boolean glutenFree) {
        this.vegan = vegan;
        this.glutenFree = glutenFree;
    }

    public boolean isVegan() {
        return vegan;
    }

    public void setVegan(boolean vegan) {
        this.vegan = vegan;
    }

    public boolean isGlutenFree() {
        return glutenFree;
    }

    public void setGlutenFree(boolean glutenFree) {
        this.glutenFree = glutenFree;
    }
}
