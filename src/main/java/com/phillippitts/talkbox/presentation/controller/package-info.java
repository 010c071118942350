/**
 * REST controllers. Thin: validation and HTTP mapping only; work happens in the service layer.
 */
package com.phillippitts.talkbox.presentation.controller;
