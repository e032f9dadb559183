package com.cario.docintel.app.model;

import lombok.Value;

/** One billed charge on an invoice: line haul, fuel surcharge, detention, lumper fee. */
@Value
public class ChargeLine {

  String description;

  long amountCents;
}
