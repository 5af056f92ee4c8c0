package com.frostguard.acoustic.ml;

import java.io.Serializable;

public interface Scaler extends Serializable {

    double[] transform(double[] row);
}
