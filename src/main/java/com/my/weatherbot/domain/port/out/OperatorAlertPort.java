package com.my.weatherbot.domain.port.out;

import com.my.weatherbot.domain.model.OperatorAlert;

public interface OperatorAlertPort {
    void raise(OperatorAlert alert);
}
